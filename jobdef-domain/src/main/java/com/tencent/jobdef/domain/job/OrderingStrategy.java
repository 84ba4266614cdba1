package com.tencent.jobdef.domain.job;

import com.tencent.jobdef.domain.exception.JobTranslationException;

/**
 * OrderingStrategy - 命令执行顺序策略
 * <p>
 * NODE_FIRST 与 STEP_FIRST 下命令列表的顺序有业务含义。
 * </p>
 *
 * @author jobdef
 */
public enum OrderingStrategy {

    /**
     * 逐个节点执行全部步骤
     */
    NODE_FIRST("node-first"),

    /**
     * 逐个步骤在全部节点上执行
     */
    STEP_FIRST("step-first"),

    /**
     * STEP_FIRST 的旧名称
     */
    SEQUENTIAL("sequential"),

    PARALLEL("parallel"),

    RULESET("ruleset");

    private final String value;

    OrderingStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws JobTranslationException 无法识别的策略名称
     */
    public static OrderingStrategy fromValue(String value) {
        for (OrderingStrategy strategy : values()) {
            if (strategy.value.equals(value)) {
                return strategy;
            }
        }
        throw JobTranslationException.unknownOrderingStrategy(value);
    }
}
