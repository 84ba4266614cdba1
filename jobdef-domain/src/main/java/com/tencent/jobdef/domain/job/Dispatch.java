package com.tencent.jobdef.domain.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dispatch - 节点分发策略（值对象）
 * <p>
 * 控制作业在多个节点上的并发度、节点排序以及单节点失败后的行为。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dispatch {

    public static final int DEFAULT_THREAD_COUNT = 1;

    public static final String DEFAULT_RANK_ORDER = "ascending";

    /**
     * 最大并发线程数
     */
    private int threadCount;

    /**
     * 某个节点失败后是否继续在其余节点上执行
     */
    private boolean keepGoing;

    /**
     * 节点排序属性
     */
    private String rankAttribute;

    /**
     * 排序方向："ascending" 或 "descending"
     */
    private String rankOrder;

    /**
     * 节点过滤结果为空时是否视为成功
     */
    private boolean successOnEmptyNodeFilter;

    /**
     * 远程系统未返回分发策略时使用的默认值
     */
    public static Dispatch defaults() {
        return Dispatch.builder()
            .threadCount(DEFAULT_THREAD_COUNT)
            .keepGoing(false)
            .rankOrder(DEFAULT_RANK_ORDER)
            .build();
    }
}
