package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OptionConfigDto - option 配置块
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OptionConfigDto {

    @NotBlank(message = "选项名称不能为空")
    private String name;

    private String label;

    private String defaultValue;

    /**
     * 可选值，元素不能为 null
     */
    private List<String> valueChoices;

    private String valueChoicesUrl;

    private boolean requirePredefinedChoice;

    private String validationRegex;

    private String description;

    private boolean required;

    private boolean allowMultipleValues;

    private String multiValueDelimiter;

    private boolean obscureInput;

    private boolean exposedToScripts;

    private String storagePath;

    /**
     * 使用包装类型，使属性名保持为 is_date
     */
    private Boolean isDate;

    private String dateFormat;
}
