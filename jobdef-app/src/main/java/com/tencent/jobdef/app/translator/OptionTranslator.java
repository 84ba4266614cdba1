package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.OptionConfigDto;
import com.tencent.jobdef.domain.option.JobOption;
import com.tencent.jobdef.domain.option.JobOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * OptionTranslator - 选项翻译器
 * <p>
 * option 配置块与 {@link JobOptions} 之间的相互转换。
 * </p>
 *
 * @author jobdef
 */
@Slf4j
public final class OptionTranslator {

    private OptionTranslator() {
    }

    /**
     * 配置块转领域对象，保持声明顺序
     *
     * @return 列表为空时返回 null
     * @throws com.tencent.jobdef.domain.exception.JobTranslationException 任一选项的交叉字段校验失败
     */
    public static JobOptions toDomain(List<OptionConfigDto> configs, boolean preserveOrder) {
        if (configs == null || configs.isEmpty()) {
            return null;
        }

        List<JobOption> options = new ArrayList<>(configs.size());
        for (int i = 0; i < configs.size(); i++) {
            JobOption option = optionToDomain(configs.get(i));
            option.validate(i);
            options.add(option);
        }
        log.debug("Translated {} job options", options.size());

        return JobOptions.builder()
            .preserveOrder(preserveOrder)
            .options(options)
            .build();
    }

    /**
     * 领域对象转配置块
     *
     * @return 没有选项时返回 null
     */
    public static List<OptionConfigDto> toConfig(JobOptions options) {
        if (options == null || options.getOptions() == null || options.getOptions().isEmpty()) {
            return null;
        }

        List<OptionConfigDto> configs = new ArrayList<>(options.getOptions().size());
        for (JobOption option : options.getOptions()) {
            configs.add(optionToConfig(option));
        }
        return configs;
    }

    private static JobOption optionToDomain(OptionConfigDto config) {
        return JobOption.builder()
            .name(config.getName())
            .label(config.getLabel())
            .defaultValue(config.getDefaultValue())
            .valueChoices(config.getValueChoices() != null
                ? new ArrayList<>(config.getValueChoices())
                : new ArrayList<>())
            .valueChoicesUrl(config.getValueChoicesUrl())
            .requirePredefinedChoice(config.isRequirePredefinedChoice())
            .validationRegex(config.getValidationRegex())
            .description(config.getDescription())
            .required(config.isRequired())
            .allowMultipleValues(config.isAllowMultipleValues())
            .multiValueDelimiter(config.getMultiValueDelimiter())
            .obscureInput(config.isObscureInput())
            .exposedToScripts(config.isExposedToScripts())
            .storagePath(config.getStoragePath())
            .isDate(Boolean.TRUE.equals(config.getIsDate()))
            .dateFormat(config.getDateFormat())
            .build();
    }

    private static OptionConfigDto optionToConfig(JobOption option) {
        return OptionConfigDto.builder()
            .name(option.getName())
            .label(option.getLabel())
            .defaultValue(option.getDefaultValue())
            .valueChoices(option.getValueChoices() != null
                ? new ArrayList<>(option.getValueChoices())
                : new ArrayList<>())
            .valueChoicesUrl(option.getValueChoicesUrl())
            .requirePredefinedChoice(option.isRequirePredefinedChoice())
            .validationRegex(option.getValidationRegex())
            .description(option.getDescription())
            .required(option.isRequired())
            .allowMultipleValues(option.isAllowMultipleValues())
            .multiValueDelimiter(option.getMultiValueDelimiter())
            .obscureInput(option.isObscureInput())
            .exposedToScripts(option.isExposedToScripts())
            .storagePath(option.getStoragePath())
            .isDate(option.isDate())
            .dateFormat(option.getDateFormat())
            .build();
    }
}
