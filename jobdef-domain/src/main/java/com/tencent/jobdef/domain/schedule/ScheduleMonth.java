package com.tencent.jobdef.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ScheduleMonth - 调度月份部分（日期、月）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleMonth {
    private String day;

    private String month;
}
