package com.tencent.jobdef.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ScheduleWeekDay - 调度星期部分
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleWeekDay {
    private String day;
}
