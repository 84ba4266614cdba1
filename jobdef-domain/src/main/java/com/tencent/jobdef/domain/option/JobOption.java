package com.tencent.jobdef.domain.option;

import com.tencent.jobdef.domain.exception.JobTranslationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JobOption - 作业选项（值对象）
 * <p>
 * 作业执行时由用户填写的输入参数。名称在同一作业内唯一。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOption {

    /**
     * 选项名称
     */
    private String name;

    /**
     * 展示名称
     */
    private String label;

    /**
     * 默认值
     */
    private String defaultValue;

    /**
     * 可选值列表，可以为空，但不能包含 null
     */
    @Builder.Default
    private List<String> valueChoices = new ArrayList<>();

    /**
     * 远程可选值列表的 URL
     */
    private String valueChoicesUrl;

    /**
     * 是否只能从可选值中选择
     */
    private boolean requirePredefinedChoice;

    /**
     * 输入值校验正则
     */
    private String validationRegex;

    private String description;

    private boolean required;

    /**
     * 是否允许多值
     */
    private boolean allowMultipleValues;

    /**
     * 多值分隔符
     */
    private String multiValueDelimiter;

    /**
     * 是否隐藏输入内容
     */
    private boolean obscureInput;

    /**
     * 是否将值暴露给脚本
     */
    private boolean exposedToScripts;

    /**
     * 安全存储中的密钥路径，如 "keys/db/password"
     */
    private String storagePath;

    /**
     * 是否为日期类型
     */
    private boolean isDate;

    /**
     * 日期格式（momentjs 格式），如 "MM/DD/YYYY hh:mm a"
     */
    private String dateFormat;

    /**
     * 校验交叉字段约束，按固定顺序检查，遇到第一个失败即抛出
     *
     * @param index 选项在列表中的位置，用于错误信息
     * @throws JobTranslationException 约束不满足
     */
    public void validate(int index) {
        if (storagePath != null && !storagePath.isEmpty() && !obscureInput) {
            throw JobTranslationException.optionValidation(name, index,
                "argument \"obscure_input\" must be set to `true` when \"storage_path\" is not empty");
        }
        if (exposedToScripts && !obscureInput) {
            throw JobTranslationException.optionValidation(name, index,
                "argument \"obscure_input\" must be set to `true` when \"exposed_to_scripts\" is set to true");
        }
        if (isDate && (dateFormat == null || dateFormat.isEmpty())) {
            throw JobTranslationException.optionValidation(name, index,
                "argument \"date_format\" must be set when \"is_date\" is set to true");
        }
        if (valueChoices != null && valueChoices.stream().anyMatch(v -> v == null || v.isEmpty())) {
            throw JobTranslationException.optionValidation(name, index,
                "argument \"value_choices\" can not have empty values; try \"required\"");
        }
    }
}
