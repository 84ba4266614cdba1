package com.tencent.jobdef.domain.exception;

/**
 * ErrorCode - 翻译错误码
 *
 * @author jobdef
 */
public enum ErrorCode {

    TOO_MANY_BLOCKS(ErrorCategory.STRUCTURAL_VIOLATION),

    TOO_MANY_NOTIFICATION_BLOCKS(ErrorCategory.STRUCTURAL_VIOLATION),

    TOO_MANY_NOTIFICATION_PLUGINS(ErrorCategory.STRUCTURAL_VIOLATION),

    OPTION_VALIDATION(ErrorCategory.FIELD_INVARIANT_VIOLATION),

    INVALID_SCHEDULE_FIELDS(ErrorCategory.FIELD_INVARIANT_VIOLATION),

    MALFORMED_SCHEDULE(ErrorCategory.FIELD_INVARIANT_VIOLATION),

    UNKNOWN_NOTIFICATION_TYPE(ErrorCategory.UNKNOWN_ENUM_VALUE),

    UNKNOWN_ORDERING_STRATEGY(ErrorCategory.UNKNOWN_ENUM_VALUE),

    DUPLICATE_NOTIFICATION_TYPE(ErrorCategory.DUPLICATE_KEY);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
