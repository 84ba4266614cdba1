package com.tencent.jobdef.domain.exception;

/**
 * ErrorCategory - 翻译错误分类
 * <p>
 * 所有分类在写入方向上都是致命的：第一个错误即中止整个作业的组装。
 * </p>
 *
 * @author jobdef
 */
public enum ErrorCategory {

    /**
     * 结构错误，如"至多一个"的配置块出现了多个
     */
    STRUCTURAL_VIOLATION,

    /**
     * 字段约束错误，如选项的交叉字段规则、调度表达式的日期字段互斥
     */
    FIELD_INVARIANT_VIOLATION,

    /**
     * 无法识别的枚举值
     */
    UNKNOWN_ENUM_VALUE,

    /**
     * 重复键，如两个通知声明同一个触发类型
     */
    DUPLICATE_KEY
}
