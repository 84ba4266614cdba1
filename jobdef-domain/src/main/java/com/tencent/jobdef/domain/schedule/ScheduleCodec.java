package com.tencent.jobdef.domain.schedule;

import com.tencent.jobdef.domain.exception.JobTranslationException;

/**
 * ScheduleCodec - 调度表达式编解码器
 * <p>
 * 文本格式固定为 7 个以空格分隔的字段：
 * seconds minute hour day-of-month month day-of-week year
 * </p>
 *
 * @author jobdef
 */
public final class ScheduleCodec {

    public static final String WILDCARD = "*";

    public static final String NO_SPECIFIC_VALUE = "?";

    private static final int FIELD_COUNT = 7;

    private ScheduleCodec() {
    }

    /**
     * 解析 cron 文本
     *
     * @throws JobTranslationException 字段数不是 7，或日期/星期字段互斥规则不满足
     */
    public static Schedule decode(String cronText) {
        String[] fields = cronText.trim().split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw JobTranslationException.malformedSchedule(cronText, fields.length);
        }

        Schedule schedule = Schedule.builder()
            .time(ScheduleTime.builder()
                .seconds(fields[0])
                .minute(fields[1])
                .hour(fields[2])
                .build())
            .month(ScheduleMonth.builder()
                .day(fields[3])
                .month(fields[4])
                .build())
            .weekDay(ScheduleWeekDay.builder()
                .day(fields[5])
                .build())
            .year(ScheduleYear.builder()
                .year(fields[6])
                .build())
            .build();

        checkDayFields(cronText, fields[3], fields[5]);
        return schedule;
    }

    /**
     * 生成规范化的 cron 文本
     * <p>
     * 空的 day-of-month 在 day-of-week 为 '*' 或空时补 '*'，否则补 '?'；
     * 随后空的 day-of-week 在 day-of-month 为 '*' 时补 '*'，否则补 '?'。
     * 不修改入参，也不做互斥校验，手工构造的调度需先调用 {@link #validate(Schedule)}。
     * </p>
     */
    public static String encode(Schedule schedule) {
        ScheduleTime time = schedule.getTime() != null ? schedule.getTime() : new ScheduleTime();
        String monthDay = dayOfMonth(schedule);
        String month = schedule.getMonth() != null ? schedule.getMonth().getMonth() : null;
        String weekDay = dayOfWeek(schedule);
        String year = schedule.getYear() != null ? schedule.getYear().getYear() : null;

        if (isEmpty(monthDay)) {
            monthDay = WILDCARD.equals(weekDay) || isEmpty(weekDay) ? WILDCARD : NO_SPECIFIC_VALUE;
        }
        if (isEmpty(weekDay)) {
            weekDay = WILDCARD.equals(monthDay) ? WILDCARD : NO_SPECIFIC_VALUE;
        }

        return String.join(" ",
            nullToEmpty(time.getSeconds()),
            nullToEmpty(time.getMinute()),
            nullToEmpty(time.getHour()),
            monthDay,
            nullToEmpty(month),
            weekDay,
            nullToEmpty(year));
    }

    /**
     * 校验手工构造的调度：补齐默认值后重新执行与 {@link #decode(String)} 相同的检查
     *
     * @throws JobTranslationException 校验失败
     */
    public static void validate(Schedule schedule) {
        decode(encode(schedule));
    }

    private static void checkDayFields(String cronText, String dayOfMonth, String dayOfWeek) {
        if (dayOfMonth.equals(dayOfWeek)) {
            if (!WILDCARD.equals(dayOfMonth)) {
                throw JobTranslationException.invalidScheduleFields(cronText, dayOfMonth, dayOfWeek);
            }
        } else if (!NO_SPECIFIC_VALUE.equals(dayOfMonth) && !NO_SPECIFIC_VALUE.equals(dayOfWeek)) {
            throw JobTranslationException.invalidScheduleFields(cronText, dayOfMonth, dayOfWeek);
        }
    }

    private static String dayOfMonth(Schedule schedule) {
        return schedule.getMonth() != null ? schedule.getMonth().getDay() : null;
    }

    private static String dayOfWeek(Schedule schedule) {
        return schedule.getWeekDay() != null ? schedule.getWeekDay().getDay() : null;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
