package com.tencent.jobdef.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ScheduleTime - 调度时间部分（秒、分、时）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleTime {
    private String seconds;

    private String minute;

    private String hour;
}
