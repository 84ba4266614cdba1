package com.tencent.jobdef.domain.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodeTest {

    @Test
    void testCategories() {
        assertThat(ErrorCode.TOO_MANY_BLOCKS.getCategory()).isEqualTo(ErrorCategory.STRUCTURAL_VIOLATION);
        assertThat(ErrorCode.TOO_MANY_NOTIFICATION_BLOCKS.getCategory()).isEqualTo(ErrorCategory.STRUCTURAL_VIOLATION);
        assertThat(ErrorCode.TOO_MANY_NOTIFICATION_PLUGINS.getCategory()).isEqualTo(ErrorCategory.STRUCTURAL_VIOLATION);
        assertThat(ErrorCode.OPTION_VALIDATION.getCategory()).isEqualTo(ErrorCategory.FIELD_INVARIANT_VIOLATION);
        assertThat(ErrorCode.INVALID_SCHEDULE_FIELDS.getCategory()).isEqualTo(ErrorCategory.FIELD_INVARIANT_VIOLATION);
        assertThat(ErrorCode.MALFORMED_SCHEDULE.getCategory()).isEqualTo(ErrorCategory.FIELD_INVARIANT_VIOLATION);
        assertThat(ErrorCode.UNKNOWN_NOTIFICATION_TYPE.getCategory()).isEqualTo(ErrorCategory.UNKNOWN_ENUM_VALUE);
        assertThat(ErrorCode.UNKNOWN_ORDERING_STRATEGY.getCategory()).isEqualTo(ErrorCategory.UNKNOWN_ENUM_VALUE);
        assertThat(ErrorCode.DUPLICATE_NOTIFICATION_TYPE.getCategory()).isEqualTo(ErrorCategory.DUPLICATE_KEY);
    }

    @Test
    void testTooManyBlocksMessage() {
        JobTranslationException e = JobTranslationException.tooManyBlocks("script_interpreter");

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOO_MANY_BLOCKS);
        assertThat(e.getMessage()).isEqualTo("rundeck command may have no more than one script_interpreter");
    }
}
