package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.JobConfigDto;
import com.tencent.jobdef.client.dto.config.LogFilterConfigDto;
import com.tencent.jobdef.domain.job.CommandSequence;
import com.tencent.jobdef.domain.job.Dispatch;
import com.tencent.jobdef.domain.job.Job;
import com.tencent.jobdef.domain.job.LogFilter;
import com.tencent.jobdef.domain.job.NodeFilter;
import com.tencent.jobdef.domain.job.OrderingStrategy;
import com.tencent.jobdef.domain.schedule.ScheduleCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * JobAssembler - 作业装配器
 * <p>
 * 负责扁平配置 {@link JobConfigDto} 与作业聚合 {@link Job} 之间的整体转换，
 * 选项、步骤、通知分别委托给对应的翻译器。
 * </p>
 * <p>
 * 写入方向遇到第一个错误即抛出，不返回部分结果；读取方向从不失败，
 * 并对远程系统可能缺省的部分做规范化：
 * <ul>
 *     <li>分发策略缺失时使用 {@link Dispatch#defaults()}</li>
 *     <li>项目名称仅在远程返回非空时回写</li>
 *     <li>节点过滤器缺失时清空三个节点过滤属性</li>
 * </ul>
 * </p>
 *
 * @author jobdef
 */
@Slf4j
public final class JobAssembler {

    private JobAssembler() {
    }

    /**
     * 扁平配置转作业
     *
     * @throws com.tencent.jobdef.domain.exception.JobTranslationException 任一配置块不满足约束
     */
    public static Job toDomain(JobConfigDto config) {
        Job job = Job.builder()
            .id(config.getId())
            .name(config.getName())
            .group(config.getGroupName())
            .project(config.getProjectName())
            .description(config.getDescription())
            .executionEnabled(config.isExecutionEnabled())
            .logLevel(config.getLogLevel())
            .allowConcurrentExecutions(config.isAllowConcurrentExecutions())
            .retry(config.getRetry())
            .timeout(config.getTimeout())
            .scheduleEnabled(config.isScheduleEnabled())
            .timeZone(config.getTimeZone())
            .dispatch(Dispatch.builder()
                .threadCount(config.getMaxThreadCount())
                .keepGoing(config.isContinueNextNodeOnError())
                .rankAttribute(config.getRankAttribute())
                .rankOrder(config.getRankOrder())
                .successOnEmptyNodeFilter(config.isSuccessOnEmptyNodeFilter())
                .build())
            .build();

        job.setCommandSequence(CommandSequence.builder()
            .keepGoing(config.isContinueOnError())
            .strategy(OrderingStrategy.fromValue(config.getCommandOrderingStrategy()))
            .globalLogFilters(logFiltersToDomain(config.getGlobalLogFilters()))
            .commands(CommandTranslator.toDomain(config.getCommands()))
            .build());

        job.setOptions(OptionTranslator.toDomain(config.getOptions(), config.isPreserveOptionsOrder()));

        job.setNodeFilter(NodeFilter.builder()
            .query(emptyToNull(config.getNodeFilterQuery()))
            .excludeQuery(emptyToNull(config.getNodeFilterExcludeQuery()))
            .excludePrecedence(config.isNodeFilterExcludePrecedence())
            .build());

        if (config.getSchedule() != null && !config.getSchedule().trim().isEmpty()) {
            job.setSchedule(ScheduleCodec.decode(config.getSchedule()));
        }

        job.setNotifications(NotificationTranslator.toDomain(config.getNotifications()));

        log.debug("Assembled job [{}] with {} commands", job.getName(),
            job.getCommandSequence().getCommands().size());
        return job;
    }

    /**
     * 作业转新的扁平配置
     */
    public static JobConfigDto toConfig(Job job) {
        return toConfig(job, new JobConfigDto());
    }

    /**
     * 作业写回已有的扁平配置
     * <p>
     * 远程未返回项目名称时保留 target 中原有的值。
     * </p>
     *
     * @return target 本身
     */
    public static JobConfigDto toConfig(Job job, JobConfigDto target) {
        target.setId(job.getId());
        target.setName(job.getName());
        target.setGroupName(job.getGroup());
        if (job.getProject() != null && !job.getProject().isEmpty()) {
            target.setProjectName(job.getProject());
        }
        target.setDescription(job.getDescription());
        target.setExecutionEnabled(job.isExecutionEnabled());
        target.setScheduleEnabled(job.isScheduleEnabled());
        target.setTimeZone(job.getTimeZone());
        target.setTimeout(job.getTimeout());
        target.setLogLevel(job.getLogLevel());
        target.setAllowConcurrentExecutions(job.isAllowConcurrentExecutions());
        target.setRetry(job.getRetry());

        Dispatch dispatch = normalizeDispatch(job.getDispatch());
        target.setMaxThreadCount(dispatch.getThreadCount());
        target.setContinueNextNodeOnError(dispatch.isKeepGoing());
        target.setRankAttribute(dispatch.getRankAttribute());
        target.setRankOrder(dispatch.getRankOrder());
        target.setSuccessOnEmptyNodeFilter(dispatch.isSuccessOnEmptyNodeFilter());

        NodeFilter nodeFilter = job.getNodeFilter();
        if (nodeFilter != null) {
            target.setNodeFilterQuery(nodeFilter.getQuery());
            target.setNodeFilterExcludeQuery(nodeFilter.getExcludeQuery());
            target.setNodeFilterExcludePrecedence(nodeFilter.isExcludePrecedence());
        } else {
            target.setNodeFilterQuery(null);
            target.setNodeFilterExcludeQuery(null);
            target.setNodeFilterExcludePrecedence(false);
        }

        if (job.getOptions() != null) {
            target.setPreserveOptionsOrder(job.getOptions().isPreserveOrder());
        } else {
            target.setPreserveOptionsOrder(false);
        }
        target.setOptions(OptionTranslator.toConfig(job.getOptions()));

        CommandSequence sequence = job.getCommandSequence();
        if (sequence != null) {
            target.setCommandOrderingStrategy(sequence.getStrategy().getValue());
            target.setContinueOnError(sequence.isKeepGoing());
            target.setGlobalLogFilters(logFiltersToConfig(sequence.getGlobalLogFilters()));
            target.setCommands(CommandTranslator.toConfig(sequence.getCommands()));
        }

        if (job.getSchedule() != null) {
            target.setSchedule(ScheduleCodec.encode(job.getSchedule()));
        } else {
            target.setSchedule(null);
        }

        target.setNotifications(NotificationTranslator.toConfig(job.getNotifications()));
        return target;
    }

    /**
     * 分发策略缺失时补默认值
     */
    static Dispatch normalizeDispatch(Dispatch dispatch) {
        return dispatch != null ? dispatch : Dispatch.defaults();
    }

    private static List<LogFilter> logFiltersToDomain(List<LogFilterConfigDto> configs) {
        if (configs == null || configs.isEmpty()) {
            return null;
        }
        List<LogFilter> filters = new ArrayList<>(configs.size());
        for (LogFilterConfigDto config : configs) {
            filters.add(LogFilter.builder()
                .type(config.getType())
                .config(CommandTranslator.copy(config.getConfig()))
                .build());
        }
        return filters;
    }

    private static List<LogFilterConfigDto> logFiltersToConfig(List<LogFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        List<LogFilterConfigDto> configs = new ArrayList<>(filters.size());
        for (LogFilter filter : filters) {
            configs.add(LogFilterConfigDto.builder()
                .type(filter.getType())
                .config(CommandTranslator.copy(filter.getConfig()))
                .build());
        }
        return configs;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
