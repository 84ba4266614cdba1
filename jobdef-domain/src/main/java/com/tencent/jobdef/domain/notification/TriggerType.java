package com.tencent.jobdef.domain.notification;

import com.tencent.jobdef.domain.exception.JobTranslationException;

/**
 * TriggerType - 通知触发类型
 * <p>
 * 声明顺序即读取方向输出通知块的顺序。
 * </p>
 *
 * @author jobdef
 */
public enum TriggerType {

    ON_SUCCESS("on_success"),

    ON_FAILURE("on_failure"),

    ON_START("on_start");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws JobTranslationException 不是三种已知触发类型之一
     */
    public static TriggerType fromValue(String value) {
        for (TriggerType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw JobTranslationException.unknownNotificationType(value);
    }
}
