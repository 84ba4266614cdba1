package com.tencent.jobdef.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ScheduleYear - 调度年份部分
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleYear {
    private String year;
}
