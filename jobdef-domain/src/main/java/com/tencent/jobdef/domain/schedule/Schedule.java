package com.tencent.jobdef.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schedule - 作业调度（值对象）
 * <p>
 * 按 Quartz cron 的七个字段分组保存：时间、月份、星期、年份。
 * 日期（day-of-month）与星期（day-of-week）不能同时为具体值，
 * 二者之一必须为 '?'，除非两者都是 '*'。
 * </p>
 * <p>
 * 文本形式的编解码见 {@link ScheduleCodec}。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {

    private ScheduleTime time;

    private ScheduleMonth month;

    private ScheduleWeekDay weekDay;

    private ScheduleYear year;
}
