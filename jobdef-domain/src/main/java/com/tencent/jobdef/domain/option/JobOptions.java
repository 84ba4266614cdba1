package com.tencent.jobdef.domain.option;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JobOptions - 作业选项集合
 * <p>
 * 只有至少包含一个选项时才会出现在作业中。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {

    /**
     * 是否按声明顺序展示选项
     */
    private boolean preserveOrder;

    @Builder.Default
    private List<JobOption> options = new ArrayList<>();
}
