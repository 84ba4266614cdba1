package com.tencent.jobdef.domain.command;

import com.tencent.jobdef.domain.job.NodeFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JobReference - 作业引用步骤
 * <p>
 * 以步骤的形式调用另一个作业，可选地覆盖被调用作业的节点过滤器。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobReference {

    /**
     * 被引用作业的名称
     */
    private String name;

    /**
     * 被引用作业的分组
     */
    private String group;

    /**
     * 是否对每个节点分别执行
     */
    private boolean runForEachNode;

    /**
     * 传给被引用作业的参数字符串，如 "-env prod"
     */
    private String args;

    /**
     * 节点过滤器覆盖（可选）
     */
    private NodeFilter nodeFilter;
}
