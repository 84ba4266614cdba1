package com.tencent.jobdef.domain.job;

import com.tencent.jobdef.domain.notification.NotificationSet;
import com.tencent.jobdef.domain.option.JobOptions;
import com.tencent.jobdef.domain.schedule.Schedule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Job - 作业定义（聚合根）
 * <p>
 * 远程作业调度系统中的一个作业。每次写入都由当前的扁平配置重新构建，
 * 不会修改之前的实例；ID 由远程系统在首次创建后分配。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    /**
     * 远程系统分配的作业 ID，创建前为空
     */
    private String id;

    /**
     * 作业名称
     */
    private String name;

    /**
     * 作业分组，如 "ops/backup"
     */
    private String group;

    /**
     * 所属项目，创建后不可变更
     */
    private String project;

    /**
     * 作业描述
     */
    private String description;

    /**
     * 是否允许执行
     */
    private boolean executionEnabled;

    /**
     * 日志级别，如 "INFO"、"DEBUG"
     */
    private String logLevel;

    /**
     * 是否允许并发执行
     */
    private boolean allowConcurrentExecutions;

    /**
     * 重试策略，原样传递给远程系统
     */
    private String retry;

    /**
     * 执行超时，如 "30m"
     */
    private String timeout;

    /**
     * 是否启用调度
     */
    private boolean scheduleEnabled;

    /**
     * 调度时区
     */
    private String timeZone;

    /**
     * 节点分发策略
     */
    private Dispatch dispatch;

    /**
     * 目标节点过滤器
     */
    private NodeFilter nodeFilter;

    /**
     * 调度（可选）
     */
    private Schedule schedule;

    /**
     * 命令序列
     */
    private CommandSequence commandSequence;

    /**
     * 选项集合（可选）
     */
    private JobOptions options;

    /**
     * 通知集合（可选）
     */
    private NotificationSet notifications;
}
