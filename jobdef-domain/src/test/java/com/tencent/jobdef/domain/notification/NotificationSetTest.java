package com.tencent.jobdef.domain.notification;

import com.tencent.jobdef.domain.exception.ErrorCode;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationSetTest {

    @Test
    void testPutAndGetByTrigger() {
        NotificationSet notifications = new NotificationSet();
        assertTrue(notifications.isEmpty());

        Notification onFailure = Notification.builder()
            .email(EmailNotification.builder().subject("failed").build())
            .build();
        notifications.put(TriggerType.ON_FAILURE, onFailure);

        assertFalse(notifications.isEmpty());
        assertSame(onFailure, notifications.get(TriggerType.ON_FAILURE));
        assertSame(onFailure, notifications.getOnFailure());
        assertNull(notifications.get(TriggerType.ON_SUCCESS));
    }

    @Test
    void testTriggerTypeFromValue() {
        assertEquals(TriggerType.ON_START, TriggerType.fromValue("on_start"));

        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> TriggerType.fromValue("on_retry"));
        assertEquals(ErrorCode.UNKNOWN_NOTIFICATION_TYPE, e.getErrorCode());
    }
}
