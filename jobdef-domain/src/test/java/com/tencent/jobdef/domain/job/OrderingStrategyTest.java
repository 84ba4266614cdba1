package com.tencent.jobdef.domain.job;

import com.tencent.jobdef.domain.exception.ErrorCategory;
import com.tencent.jobdef.domain.exception.ErrorCode;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderingStrategyTest {

    @Test
    void testFromValue() {
        assertEquals(OrderingStrategy.NODE_FIRST, OrderingStrategy.fromValue("node-first"));
        assertEquals(OrderingStrategy.STEP_FIRST, OrderingStrategy.fromValue("step-first"));
        assertEquals("parallel", OrderingStrategy.PARALLEL.getValue());
    }

    @Test
    void testUnknownStrategy() {
        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> OrderingStrategy.fromValue("random"));

        assertEquals(ErrorCode.UNKNOWN_ORDERING_STRATEGY, e.getErrorCode());
        assertEquals(ErrorCategory.UNKNOWN_ENUM_VALUE, e.getCategory());
    }

    @Test
    void testDispatchDefaults() {
        Dispatch dispatch = Dispatch.defaults();

        assertEquals(1, dispatch.getThreadCount());
        assertFalse(dispatch.isKeepGoing());
        assertNull(dispatch.getRankAttribute());
        assertEquals("ascending", dispatch.getRankOrder());
    }
}
