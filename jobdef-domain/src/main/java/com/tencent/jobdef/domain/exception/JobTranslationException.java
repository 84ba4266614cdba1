package com.tencent.jobdef.domain.exception;

/**
 * JobTranslationException - 扁平配置到作业定义的翻译失败
 * <p>
 * 只在写入方向（配置 -> 领域对象）抛出。读取方向的转换从不失败。
 * </p>
 *
 * @author jobdef
 */
public class JobTranslationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    public JobTranslationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }

    /**
     * "至多一个"的配置块出现了多个条目
     */
    public static JobTranslationException tooManyBlocks(String blockName) {
        return new JobTranslationException(ErrorCode.TOO_MANY_BLOCKS,
            "rundeck command may have no more than one " + blockName);
    }

    public static JobTranslationException tooManyNotificationBlocks(int count) {
        return new JobTranslationException(ErrorCode.TOO_MANY_NOTIFICATION_BLOCKS,
            "can only have up to three notification blocks, `on_success`, `on_failure`, `on_start`, got " + count);
    }

    public static JobTranslationException tooManyNotificationPlugins(String triggerType) {
        return new JobTranslationException(ErrorCode.TOO_MANY_NOTIFICATION_PLUGINS,
            "notification '" + triggerType + "' may have no more than one plugin");
    }

    public static JobTranslationException unknownNotificationType(String triggerType) {
        return new JobTranslationException(ErrorCode.UNKNOWN_NOTIFICATION_TYPE,
            "the notification type '" + triggerType + "' is not one of `on_success`, `on_failure`, `on_start`");
    }

    public static JobTranslationException duplicateNotificationType(String triggerType) {
        return new JobTranslationException(ErrorCode.DUPLICATE_NOTIFICATION_TYPE,
            "a notification block with " + triggerType + " already exists");
    }

    public static JobTranslationException unknownOrderingStrategy(String strategy) {
        return new JobTranslationException(ErrorCode.UNKNOWN_ORDERING_STRATEGY,
            "unknown command ordering strategy: " + strategy);
    }

    /**
     * 选项交叉字段校验失败
     *
     * @param index 选项在列表中的位置（从 0 开始）
     */
    public static JobTranslationException optionValidation(String optionName, int index, String rule) {
        return new JobTranslationException(ErrorCode.OPTION_VALIDATION,
            "option '" + optionName + "' (index " + index + "): " + rule);
    }

    public static JobTranslationException malformedSchedule(String cronText, int fieldCount) {
        return new JobTranslationException(ErrorCode.MALFORMED_SCHEDULE,
            "the schedule '" + cronText + "' has " + fieldCount + " fields but must be formatted like a "
                + "7-field quartz cron expression: seconds minute hour day-of-month month day-of-week year");
    }

    public static JobTranslationException invalidScheduleFields(String cronText, String dayOfMonth, String dayOfWeek) {
        return new JobTranslationException(ErrorCode.INVALID_SCHEDULE_FIELDS,
            "invalid 'schedule' specification " + cronText + " - one of day-of-month (4th item, '" + dayOfMonth
                + "') or day-of-week (6th item, '" + dayOfWeek + "') must be '?'");
    }
}
