package com.tencent.jobdef.domain.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NodeFilter - 节点过滤器（值对象）
 * <p>
 * 查询字段为 null 表示未设置，不会保存空字符串。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeFilter {

    /**
     * 包含查询，如 "tags: web"
     */
    private String query;

    /**
     * 排除查询
     */
    private String excludeQuery;

    /**
     * 排除条件是否优先
     */
    private boolean excludePrecedence;
}
