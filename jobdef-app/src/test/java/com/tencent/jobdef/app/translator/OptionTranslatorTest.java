package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.OptionConfigDto;
import com.tencent.jobdef.domain.exception.ErrorCode;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import com.tencent.jobdef.domain.option.JobOption;
import com.tencent.jobdef.domain.option.JobOptions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptionTranslatorTest {

    @Test
    void testEmptyOptionsAreAbsent() {
        assertNull(OptionTranslator.toDomain(null, true));
        assertNull(OptionTranslator.toDomain(Collections.emptyList(), true));
        assertNull(OptionTranslator.toConfig(null));
        assertNull(OptionTranslator.toConfig(new JobOptions()));
    }

    @Test
    void testKeepsDeclarationOrderAndPreserveFlag() {
        JobOptions options = OptionTranslator.toDomain(JobConfigFixtures.fullJob().getOptions(), true);

        assertTrue(options.isPreserveOrder());
        assertEquals(3, options.getOptions().size());
        assertEquals("env", options.getOptions().get(0).getName());
        assertEquals("db_password", options.getOptions().get(1).getName());
        assertEquals("run_date", options.getOptions().get(2).getName());

        JobOption runDate = options.getOptions().get(2);
        assertTrue(runDate.isDate());
        assertEquals("MM/DD/YYYY", runDate.getDateFormat());
    }

    @Test
    void testMissingChoicesBecomeEmptyList() {
        JobOptions options = OptionTranslator.toDomain(Collections.singletonList(
            OptionConfigDto.builder().name("free_text").build()), false);

        JobOption option = options.getOptions().get(0);
        assertNotNull(option.getValueChoices());
        assertTrue(option.getValueChoices().isEmpty());
        assertFalse(option.isDate());
    }

    @Test
    void testReportsIndexOfInvalidOption() {
        List<OptionConfigDto> configs = Arrays.asList(
            OptionConfigDto.builder().name("ok").build(),
            OptionConfigDto.builder().name("token").storagePath("keys/token").build());

        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> OptionTranslator.toDomain(configs, false));
        assertEquals(ErrorCode.OPTION_VALIDATION, e.getErrorCode());
        assertTrue(e.getMessage().contains("token"));
        assertTrue(e.getMessage().contains("index 1"));
    }

    @Test
    void testRejectsEmptyChoice() {
        List<OptionConfigDto> configs = Collections.singletonList(
            OptionConfigDto.builder().name("env").valueChoices(Collections.singletonList("")).build());

        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> OptionTranslator.toDomain(configs, false));
        assertEquals(ErrorCode.OPTION_VALIDATION, e.getErrorCode());
        assertTrue(e.getMessage().contains("value_choices"));
    }

    @Test
    void testDateOptionNeedsFormat() {
        List<OptionConfigDto> configs = Collections.singletonList(
            OptionConfigDto.builder().name("when").isDate(true).build());

        assertThrows(JobTranslationException.class, () -> OptionTranslator.toDomain(configs, false));
    }

    @Test
    void testRoundTripWritesDateAttributes() {
        List<OptionConfigDto> configs = JobConfigFixtures.fullJob().getOptions();

        List<OptionConfigDto> written = OptionTranslator.toConfig(OptionTranslator.toDomain(configs, true));

        assertEquals(configs, written);
        assertEquals(Boolean.TRUE, written.get(2).getIsDate());
        assertEquals("MM/DD/YYYY", written.get(2).getDateFormat());
    }
}
