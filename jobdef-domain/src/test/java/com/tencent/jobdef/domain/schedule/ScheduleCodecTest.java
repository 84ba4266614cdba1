package com.tencent.jobdef.domain.schedule;

import com.tencent.jobdef.domain.exception.ErrorCode;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleCodecTest {

    @Test
    void testDecodeFillsFieldsPositionally() {
        Schedule schedule = ScheduleCodec.decode("0 30 12 ? 1 MON 2025");

        assertEquals("0", schedule.getTime().getSeconds());
        assertEquals("30", schedule.getTime().getMinute());
        assertEquals("12", schedule.getTime().getHour());
        assertEquals("?", schedule.getMonth().getDay());
        assertEquals("1", schedule.getMonth().getMonth());
        assertEquals("MON", schedule.getWeekDay().getDay());
        assertEquals("2025", schedule.getYear().getYear());
    }

    @Test
    void testDecodeAcceptsBothWildcards() {
        Schedule schedule = ScheduleCodec.decode("0 0 12 * 1 * *");

        assertEquals("*", schedule.getMonth().getDay());
        assertEquals("*", schedule.getWeekDay().getDay());
    }

    @Test
    void testDecodeRejectsTwoConcreteDays() {
        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> ScheduleCodec.decode("0 0 12 15 1 MON *"));

        assertEquals(ErrorCode.INVALID_SCHEDULE_FIELDS, e.getErrorCode());
        assertTrue(e.getMessage().contains("15"));
        assertTrue(e.getMessage().contains("MON"));
        assertTrue(e.getMessage().contains("0 0 12 15 1 MON *"));
    }

    @Test
    void testDecodeRejectsSameConcreteDay() {
        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> ScheduleCodec.decode("0 0 12 5 1 5 *"));

        assertEquals(ErrorCode.INVALID_SCHEDULE_FIELDS, e.getErrorCode());
    }

    @Test
    void testDecodeRejectsWrongFieldCount() {
        JobTranslationException e = assertThrows(JobTranslationException.class,
            () -> ScheduleCodec.decode("0 0 12 * * ?"));

        assertEquals(ErrorCode.MALFORMED_SCHEDULE, e.getErrorCode());
        assertTrue(e.getMessage().contains("6 fields"));
    }

    @Test
    void testEncodeDefaultsEmptyDays() {
        Schedule bothEmpty = Schedule.builder()
            .time(ScheduleTime.builder().seconds("0").minute("0").hour("8").build())
            .month(ScheduleMonth.builder().month("*").build())
            .year(ScheduleYear.builder().year("*").build())
            .build();
        assertEquals("0 0 8 * * * *", ScheduleCodec.encode(bothEmpty));

        Schedule weekDayOnly = Schedule.builder()
            .time(ScheduleTime.builder().seconds("0").minute("0").hour("8").build())
            .month(ScheduleMonth.builder().month("*").build())
            .weekDay(ScheduleWeekDay.builder().day("FRI").build())
            .year(ScheduleYear.builder().year("*").build())
            .build();
        assertEquals("0 0 8 ? * FRI *", ScheduleCodec.encode(weekDayOnly));

        Schedule monthDayOnly = Schedule.builder()
            .time(ScheduleTime.builder().seconds("0").minute("0").hour("8").build())
            .month(ScheduleMonth.builder().day("1").month("*").build())
            .year(ScheduleYear.builder().year("*").build())
            .build();
        assertEquals("0 0 8 1 * ? *", ScheduleCodec.encode(monthDayOnly));
    }

    @Test
    void testEncodeDoesNotMutateSchedule() {
        Schedule schedule = Schedule.builder()
            .time(ScheduleTime.builder().seconds("0").minute("0").hour("8").build())
            .month(ScheduleMonth.builder().month("*").build())
            .weekDay(ScheduleWeekDay.builder().day("FRI").build())
            .year(ScheduleYear.builder().year("*").build())
            .build();

        ScheduleCodec.encode(schedule);

        assertNull(schedule.getMonth().getDay());
    }

    @Test
    void testEncodeIsIdempotentAfterDecode() {
        String[] valid = {"0 0 12 ? 1 MON *", "0 0 12 * 1 * *", "0 15 10 15 * ? 2030"};
        for (String text : valid) {
            String encoded = ScheduleCodec.encode(ScheduleCodec.decode(text));
            assertEquals(text, encoded);
            assertEquals(encoded, ScheduleCodec.encode(ScheduleCodec.decode(encoded)));
        }
    }

    @Test
    void testValidateRejectsHandBuiltSchedule() {
        Schedule schedule = Schedule.builder()
            .time(ScheduleTime.builder().seconds("0").minute("0").hour("8").build())
            .month(ScheduleMonth.builder().day("10").month("*").build())
            .weekDay(ScheduleWeekDay.builder().day("TUE").build())
            .year(ScheduleYear.builder().year("*").build())
            .build();

        assertThrows(JobTranslationException.class, () -> ScheduleCodec.validate(schedule));
    }
}
