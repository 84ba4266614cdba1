package com.tencent.jobdef.domain.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NotificationSet - 作业通知集合
 * <p>
 * 每种触发类型最多一个通知。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSet {

    private Notification onSuccess;

    private Notification onFailure;

    private Notification onStart;

    /**
     * 获取指定触发类型的通知
     */
    public Notification get(TriggerType type) {
        switch (type) {
            case ON_SUCCESS:
                return onSuccess;
            case ON_FAILURE:
                return onFailure;
            case ON_START:
                return onStart;
            default:
                throw new IllegalArgumentException("Unsupported trigger type: " + type);
        }
    }

    /**
     * 设置指定触发类型的通知
     */
    public void put(TriggerType type, Notification notification) {
        switch (type) {
            case ON_SUCCESS:
                onSuccess = notification;
                break;
            case ON_FAILURE:
                onFailure = notification;
                break;
            case ON_START:
                onStart = notification;
                break;
            default:
                throw new IllegalArgumentException("Unsupported trigger type: " + type);
        }
    }

    /**
     * 是否一个通知都没有
     */
    public boolean isEmpty() {
        return onSuccess == null && onFailure == null && onStart == null;
    }
}
