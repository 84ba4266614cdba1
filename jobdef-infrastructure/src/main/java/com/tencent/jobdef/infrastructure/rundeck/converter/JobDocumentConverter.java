package com.tencent.jobdef.infrastructure.rundeck.converter;

import com.tencent.jobdef.domain.command.Command;
import com.tencent.jobdef.domain.command.JobReference;
import com.tencent.jobdef.domain.command.ScriptInterpreter;
import com.tencent.jobdef.domain.job.CommandSequence;
import com.tencent.jobdef.domain.job.Dispatch;
import com.tencent.jobdef.domain.job.Job;
import com.tencent.jobdef.domain.job.LogFilter;
import com.tencent.jobdef.domain.job.NodeFilter;
import com.tencent.jobdef.domain.job.OrderingStrategy;
import com.tencent.jobdef.domain.notification.EmailNotification;
import com.tencent.jobdef.domain.notification.Notification;
import com.tencent.jobdef.domain.notification.NotificationSet;
import com.tencent.jobdef.domain.notification.WebHookNotification;
import com.tencent.jobdef.domain.option.JobOption;
import com.tencent.jobdef.domain.option.JobOptions;
import com.tencent.jobdef.domain.plugin.JobPlugin;
import com.tencent.jobdef.domain.schedule.Schedule;
import com.tencent.jobdef.domain.schedule.ScheduleMonth;
import com.tencent.jobdef.domain.schedule.ScheduleTime;
import com.tencent.jobdef.domain.schedule.ScheduleWeekDay;
import com.tencent.jobdef.domain.schedule.ScheduleYear;
import com.tencent.jobdef.infrastructure.rundeck.entity.CommandDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.ContextDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.DispatchDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.JobDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.JobRefDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.LogFilterDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.NodeFilterDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.NotificationDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.OptionDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.OptionsDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.PluginDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.ScheduleDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.ScriptInterpreterDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.SequenceDO;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JobDocumentConverter - 作业文档转换器
 * <p>
 * 负责领域对象与 Rundeck 作业 XML 数据对象之间的转换。
 * 选项可选值、邮件收件人、WebHook 地址在文档中以逗号拼接，在这里拆分与合并。
 * </p>
 *
 * @author jobdef
 */
public class JobDocumentConverter {

    private static final String LIST_SEPARATOR = ",";

    /**
     * 领域对象转数据对象
     */
    public static JobDO toDataObject(Job domain) {
        if (domain == null) {
            return null;
        }

        JobDO dataObject = new JobDO();
        dataObject.setId(domain.getId());
        dataObject.setUuid(domain.getId());
        dataObject.setName(domain.getName());
        dataObject.setGroup(emptyToNull(domain.getGroup()));
        dataObject.setDescription(domain.getDescription());
        dataObject.setExecutionEnabled(domain.isExecutionEnabled());
        dataObject.setScheduleEnabled(domain.isScheduleEnabled());
        dataObject.setTimeZone(emptyToNull(domain.getTimeZone()));
        dataObject.setTimeout(emptyToNull(domain.getTimeout()));
        dataObject.setLogLevel(domain.getLogLevel());
        dataObject.setMultipleExecutions(domain.isAllowConcurrentExecutions());
        dataObject.setRetry(emptyToNull(domain.getRetry()));

        ContextDO context = new ContextDO();
        context.setProject(domain.getProject());
        context.setOptions(optionsToDataObject(domain.getOptions()));
        dataObject.setContext(context);

        if (domain.getDispatch() != null) {
            Dispatch dispatch = domain.getDispatch();
            DispatchDO dispatchDO = new DispatchDO();
            dispatchDO.setThreadCount(dispatch.getThreadCount());
            dispatchDO.setKeepGoing(dispatch.isKeepGoing());
            dispatchDO.setRankAttribute(emptyToNull(dispatch.getRankAttribute()));
            dispatchDO.setRankOrder(dispatch.getRankOrder());
            dispatchDO.setSuccessOnEmptyNodeFilter(dispatch.isSuccessOnEmptyNodeFilter());
            dataObject.setDispatch(dispatchDO);
        }

        dataObject.setNodeFilter(nodeFilterToDataObject(domain.getNodeFilter()));
        dataObject.setSchedule(scheduleToDataObject(domain.getSchedule()));
        dataObject.setSequence(sequenceToDataObject(domain.getCommandSequence()));
        dataObject.setNotification(notificationsToDataObject(domain.getNotifications()));

        return dataObject;
    }

    /**
     * 数据对象转领域对象
     */
    public static Job toDomain(JobDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        Job domain = new Job();
        domain.setId(StringUtils.hasText(dataObject.getId()) ? dataObject.getId() : dataObject.getUuid());
        domain.setName(dataObject.getName());
        domain.setGroup(dataObject.getGroup());
        domain.setDescription(dataObject.getDescription());
        domain.setExecutionEnabled(!Boolean.FALSE.equals(dataObject.getExecutionEnabled()));
        domain.setScheduleEnabled(!Boolean.FALSE.equals(dataObject.getScheduleEnabled()));
        domain.setTimeZone(dataObject.getTimeZone());
        domain.setTimeout(dataObject.getTimeout());
        domain.setLogLevel(dataObject.getLogLevel());
        domain.setAllowConcurrentExecutions(Boolean.TRUE.equals(dataObject.getMultipleExecutions()));
        domain.setRetry(dataObject.getRetry());

        if (dataObject.getContext() != null) {
            domain.setProject(dataObject.getContext().getProject());
            domain.setOptions(optionsToDomain(dataObject.getContext().getOptions()));
        }

        // 缺失时保持 null，由读取方向的规范化补默认值
        if (dataObject.getDispatch() != null) {
            DispatchDO dispatchDO = dataObject.getDispatch();
            domain.setDispatch(Dispatch.builder()
                .threadCount(dispatchDO.getThreadCount() != null
                    ? dispatchDO.getThreadCount()
                    : Dispatch.DEFAULT_THREAD_COUNT)
                .keepGoing(Boolean.TRUE.equals(dispatchDO.getKeepGoing()))
                .rankAttribute(dispatchDO.getRankAttribute())
                .rankOrder(dispatchDO.getRankOrder() != null
                    ? dispatchDO.getRankOrder()
                    : Dispatch.DEFAULT_RANK_ORDER)
                .successOnEmptyNodeFilter(Boolean.TRUE.equals(dispatchDO.getSuccessOnEmptyNodeFilter()))
                .build());
        }

        domain.setNodeFilter(nodeFilterToDomain(dataObject.getNodeFilter()));
        domain.setSchedule(scheduleToDomain(dataObject.getSchedule()));
        domain.setCommandSequence(sequenceToDomain(dataObject.getSequence()));
        domain.setNotifications(notificationsToDomain(dataObject.getNotification()));

        return domain;
    }

    private static OptionsDO optionsToDataObject(JobOptions options) {
        if (options == null) {
            return null;
        }
        OptionsDO optionsDO = new OptionsDO();
        optionsDO.setPreserveOrder(options.isPreserveOrder());
        optionsDO.setOptions(options.getOptions().stream()
            .map(JobDocumentConverter::optionToDataObject)
            .collect(Collectors.toList()));
        return optionsDO;
    }

    private static OptionDO optionToDataObject(JobOption option) {
        OptionDO optionDO = new OptionDO();
        optionDO.setName(option.getName());
        optionDO.setLabel(emptyToNull(option.getLabel()));
        optionDO.setDefaultValue(emptyToNull(option.getDefaultValue()));
        if (option.getValueChoices() != null && !option.getValueChoices().isEmpty()) {
            optionDO.setValues(String.join(LIST_SEPARATOR, option.getValueChoices()));
        }
        optionDO.setValuesUrl(emptyToNull(option.getValueChoicesUrl()));
        optionDO.setEnforcedValues(option.isRequirePredefinedChoice());
        optionDO.setRegex(emptyToNull(option.getValidationRegex()));
        optionDO.setDescription(emptyToNull(option.getDescription()));
        optionDO.setRequired(option.isRequired());
        optionDO.setMultivalued(option.isAllowMultipleValues());
        optionDO.setDelimiter(emptyToNull(option.getMultiValueDelimiter()));
        optionDO.setSecure(option.isObscureInput());
        optionDO.setValueExposed(option.isExposedToScripts());
        optionDO.setStoragePath(emptyToNull(option.getStoragePath()));
        optionDO.setDate(option.isDate());
        optionDO.setDateFormat(emptyToNull(option.getDateFormat()));
        return optionDO;
    }

    private static JobOptions optionsToDomain(OptionsDO optionsDO) {
        if (optionsDO == null || optionsDO.getOptions() == null || optionsDO.getOptions().isEmpty()) {
            return null;
        }
        return JobOptions.builder()
            .preserveOrder(Boolean.TRUE.equals(optionsDO.getPreserveOrder()))
            .options(optionsDO.getOptions().stream()
                .map(JobDocumentConverter::optionToDomain)
                .collect(Collectors.toList()))
            .build();
    }

    private static JobOption optionToDomain(OptionDO optionDO) {
        return JobOption.builder()
            .name(optionDO.getName())
            .label(optionDO.getLabel())
            .defaultValue(optionDO.getDefaultValue())
            .valueChoices(split(optionDO.getValues()))
            .valueChoicesUrl(optionDO.getValuesUrl())
            .requirePredefinedChoice(Boolean.TRUE.equals(optionDO.getEnforcedValues()))
            .validationRegex(optionDO.getRegex())
            .description(optionDO.getDescription())
            .required(Boolean.TRUE.equals(optionDO.getRequired()))
            .allowMultipleValues(Boolean.TRUE.equals(optionDO.getMultivalued()))
            .multiValueDelimiter(optionDO.getDelimiter())
            .obscureInput(Boolean.TRUE.equals(optionDO.getSecure()))
            .exposedToScripts(Boolean.TRUE.equals(optionDO.getValueExposed()))
            .storagePath(optionDO.getStoragePath())
            .isDate(Boolean.TRUE.equals(optionDO.getDate()))
            .dateFormat(optionDO.getDateFormat())
            .build();
    }

    private static NodeFilterDO nodeFilterToDataObject(NodeFilter nodeFilter) {
        if (nodeFilter == null) {
            return null;
        }
        NodeFilterDO nodeFilterDO = new NodeFilterDO();
        nodeFilterDO.setExcludePrecedence(nodeFilter.isExcludePrecedence());
        nodeFilterDO.setFilter(emptyToNull(nodeFilter.getQuery()));
        nodeFilterDO.setFilterExclude(emptyToNull(nodeFilter.getExcludeQuery()));
        return nodeFilterDO;
    }

    private static NodeFilter nodeFilterToDomain(NodeFilterDO nodeFilterDO) {
        if (nodeFilterDO == null) {
            return null;
        }
        return NodeFilter.builder()
            .query(emptyToNull(nodeFilterDO.getFilter()))
            .excludeQuery(emptyToNull(nodeFilterDO.getFilterExclude()))
            .excludePrecedence(Boolean.TRUE.equals(nodeFilterDO.getExcludePrecedence()))
            .build();
    }

    private static ScheduleDO scheduleToDataObject(Schedule schedule) {
        if (schedule == null) {
            return null;
        }
        ScheduleDO scheduleDO = new ScheduleDO();
        if (schedule.getTime() != null) {
            ScheduleDO.Time time = new ScheduleDO.Time();
            time.setSeconds(schedule.getTime().getSeconds());
            time.setMinute(schedule.getTime().getMinute());
            time.setHour(schedule.getTime().getHour());
            scheduleDO.setTime(time);
        }
        if (schedule.getMonth() != null) {
            ScheduleDO.Month month = new ScheduleDO.Month();
            month.setDay(schedule.getMonth().getDay());
            month.setMonth(schedule.getMonth().getMonth());
            scheduleDO.setMonth(month);
        }
        if (schedule.getWeekDay() != null) {
            ScheduleDO.WeekDay weekDay = new ScheduleDO.WeekDay();
            weekDay.setDay(schedule.getWeekDay().getDay());
            scheduleDO.setWeekDay(weekDay);
        }
        if (schedule.getYear() != null) {
            ScheduleDO.Year year = new ScheduleDO.Year();
            year.setYear(schedule.getYear().getYear());
            scheduleDO.setYear(year);
        }
        return scheduleDO;
    }

    private static Schedule scheduleToDomain(ScheduleDO scheduleDO) {
        if (scheduleDO == null) {
            return null;
        }
        Schedule schedule = new Schedule();
        if (scheduleDO.getTime() != null) {
            schedule.setTime(ScheduleTime.builder()
                .seconds(scheduleDO.getTime().getSeconds())
                .minute(scheduleDO.getTime().getMinute())
                .hour(scheduleDO.getTime().getHour())
                .build());
        }
        if (scheduleDO.getMonth() != null) {
            schedule.setMonth(ScheduleMonth.builder()
                .day(scheduleDO.getMonth().getDay())
                .month(scheduleDO.getMonth().getMonth())
                .build());
        }
        if (scheduleDO.getWeekDay() != null) {
            schedule.setWeekDay(ScheduleWeekDay.builder()
                .day(scheduleDO.getWeekDay().getDay())
                .build());
        }
        if (scheduleDO.getYear() != null) {
            schedule.setYear(ScheduleYear.builder()
                .year(scheduleDO.getYear().getYear())
                .build());
        }
        return schedule;
    }

    private static SequenceDO sequenceToDataObject(CommandSequence sequence) {
        if (sequence == null) {
            return null;
        }
        SequenceDO sequenceDO = new SequenceDO();
        sequenceDO.setKeepGoing(sequence.isKeepGoing());
        sequenceDO.setStrategy(sequence.getStrategy().getValue());
        sequenceDO.setCommands(sequence.getCommands().stream()
            .map(JobDocumentConverter::commandToDataObject)
            .collect(Collectors.toList()));
        if (sequence.getGlobalLogFilters() != null && !sequence.getGlobalLogFilters().isEmpty()) {
            sequenceDO.setLogFilters(sequence.getGlobalLogFilters().stream()
                .map(JobDocumentConverter::logFilterToDataObject)
                .collect(Collectors.toList()));
        }
        return sequenceDO;
    }

    private static CommandSequence sequenceToDomain(SequenceDO sequenceDO) {
        if (sequenceDO == null) {
            return null;
        }
        CommandSequence sequence = CommandSequence.builder()
            .keepGoing(Boolean.TRUE.equals(sequenceDO.getKeepGoing()))
            .strategy(strategyToDomain(sequenceDO.getStrategy()))
            .build();
        if (sequenceDO.getCommands() != null) {
            sequence.setCommands(sequenceDO.getCommands().stream()
                .map(JobDocumentConverter::commandToDomain)
                .collect(Collectors.toList()));
        }
        if (sequenceDO.getLogFilters() != null && !sequenceDO.getLogFilters().isEmpty()) {
            sequence.setGlobalLogFilters(sequenceDO.getLogFilters().stream()
                .map(JobDocumentConverter::logFilterToDomain)
                .collect(Collectors.toList()));
        }
        return sequence;
    }

    /**
     * 读取方向不抛异常，无法识别的策略按 node-first 处理
     */
    private static OrderingStrategy strategyToDomain(String strategy) {
        for (OrderingStrategy candidate : OrderingStrategy.values()) {
            if (candidate.getValue().equals(strategy)) {
                return candidate;
            }
        }
        return OrderingStrategy.NODE_FIRST;
    }

    private static LogFilterDO logFilterToDataObject(LogFilter logFilter) {
        LogFilterDO logFilterDO = new LogFilterDO();
        logFilterDO.setType(logFilter.getType());
        logFilterDO.setConfig(copy(logFilter.getConfig()));
        return logFilterDO;
    }

    private static LogFilter logFilterToDomain(LogFilterDO logFilterDO) {
        return LogFilter.builder()
            .type(logFilterDO.getType())
            .config(copy(logFilterDO.getConfig()))
            .build();
    }

    private static CommandDO commandToDataObject(Command command) {
        CommandDO commandDO = new CommandDO();
        commandDO.setKeepGoingOnSuccess(command.isKeepGoingOnSuccess());
        commandDO.setDescription(emptyToNull(command.getDescription()));
        commandDO.setExec(emptyToNull(command.getShellCommand()));
        commandDO.setScript(emptyToNull(command.getInlineScript()));
        commandDO.setScriptFile(emptyToNull(command.getScriptFile()));
        commandDO.setScriptArgs(emptyToNull(command.getScriptFileArgs()));

        ScriptInterpreter interpreter = command.getScriptInterpreter();
        if (interpreter != null) {
            ScriptInterpreterDO interpreterDO = new ScriptInterpreterDO();
            interpreterDO.setArgsQuoted(interpreter.isArgsQuoted());
            interpreterDO.setInvocationString(interpreter.getInvocationString());
            commandDO.setScriptInterpreter(interpreterDO);
        }

        JobReference jobRef = command.getJobReference();
        if (jobRef != null) {
            JobRefDO jobRefDO = new JobRefDO();
            jobRefDO.setName(jobRef.getName());
            jobRefDO.setGroup(emptyToNull(jobRef.getGroup()));
            jobRefDO.setNodeStep(jobRef.isRunForEachNode());
            if (StringUtils.hasText(jobRef.getArgs())) {
                JobRefDO.Arg arg = new JobRefDO.Arg();
                arg.setLine(jobRef.getArgs());
                jobRefDO.setArg(arg);
            }
            jobRefDO.setNodeFilter(nodeFilterToDataObject(jobRef.getNodeFilter()));
            commandDO.setJobRef(jobRefDO);
        }

        commandDO.setStepPlugin(pluginToDataObject(command.getStepPlugin()));
        commandDO.setNodeStepPlugin(pluginToDataObject(command.getNodeStepPlugin()));

        if (command.getErrorHandler() != null) {
            commandDO.setErrorHandler(commandToDataObject(command.getErrorHandler()));
        }
        return commandDO;
    }

    private static Command commandToDomain(CommandDO commandDO) {
        Command command = Command.builder()
            .keepGoingOnSuccess(Boolean.TRUE.equals(commandDO.getKeepGoingOnSuccess()))
            .description(commandDO.getDescription())
            .shellCommand(commandDO.getExec())
            .inlineScript(commandDO.getScript())
            .scriptFile(commandDO.getScriptFile())
            .scriptFileArgs(commandDO.getScriptArgs())
            .stepPlugin(pluginToDomain(commandDO.getStepPlugin()))
            .nodeStepPlugin(pluginToDomain(commandDO.getNodeStepPlugin()))
            .build();

        ScriptInterpreterDO interpreterDO = commandDO.getScriptInterpreter();
        if (interpreterDO != null) {
            command.setScriptInterpreter(ScriptInterpreter.builder()
                .invocationString(interpreterDO.getInvocationString())
                .argsQuoted(Boolean.TRUE.equals(interpreterDO.getArgsQuoted()))
                .build());
        }

        JobRefDO jobRefDO = commandDO.getJobRef();
        if (jobRefDO != null) {
            command.setJobReference(JobReference.builder()
                .name(jobRefDO.getName())
                .group(jobRefDO.getGroup())
                .runForEachNode(Boolean.TRUE.equals(jobRefDO.getNodeStep()))
                .args(jobRefDO.getArg() != null ? jobRefDO.getArg().getLine() : null)
                .nodeFilter(nodeFilterToDomain(jobRefDO.getNodeFilter()))
                .build());
        }

        // 错误处理器只保留一层
        if (commandDO.getErrorHandler() != null) {
            Command errorHandler = commandToDomain(commandDO.getErrorHandler());
            errorHandler.setErrorHandler(null);
            command.setErrorHandler(errorHandler);
        }
        return command;
    }

    private static PluginDO pluginToDataObject(JobPlugin plugin) {
        if (plugin == null) {
            return null;
        }
        PluginDO pluginDO = new PluginDO();
        pluginDO.setType(plugin.getType());
        List<PluginDO.Entry> entries = new ArrayList<>();
        if (plugin.getConfig() != null) {
            plugin.getConfig().forEach((key, value) -> entries.add(new PluginDO.Entry(key, value)));
        }
        pluginDO.setConfiguration(entries);
        return pluginDO;
    }

    private static JobPlugin pluginToDomain(PluginDO pluginDO) {
        if (pluginDO == null) {
            return null;
        }
        Map<String, String> config = new LinkedHashMap<>();
        if (pluginDO.getConfiguration() != null) {
            for (PluginDO.Entry entry : pluginDO.getConfiguration()) {
                config.put(entry.getKey(), entry.getValue());
            }
        }
        return JobPlugin.builder()
            .type(pluginDO.getType())
            .config(config)
            .build();
    }

    private static NotificationDO notificationsToDataObject(NotificationSet notifications) {
        if (notifications == null || notifications.isEmpty()) {
            return null;
        }
        NotificationDO notificationDO = new NotificationDO();
        notificationDO.setOnSuccess(triggerToDataObject(notifications.getOnSuccess()));
        notificationDO.setOnFailure(triggerToDataObject(notifications.getOnFailure()));
        notificationDO.setOnStart(triggerToDataObject(notifications.getOnStart()));
        return notificationDO;
    }

    private static NotificationDO.Trigger triggerToDataObject(Notification notification) {
        if (notification == null) {
            return null;
        }
        NotificationDO.Trigger trigger = new NotificationDO.Trigger();
        EmailNotification email = notification.getEmail();
        if (email != null) {
            NotificationDO.Email emailDO = new NotificationDO.Email();
            emailDO.setAttachLog(email.isAttachLog());
            emailDO.setRecipients(String.join(LIST_SEPARATOR, email.getRecipients()));
            emailDO.setSubject(emptyToNull(email.getSubject()));
            trigger.setEmail(emailDO);
        }
        WebHookNotification webHook = notification.getWebHook();
        if (webHook != null) {
            NotificationDO.WebHook webHookDO = new NotificationDO.WebHook();
            webHookDO.setUrls(String.join(LIST_SEPARATOR, webHook.getUrls()));
            trigger.setWebHook(webHookDO);
            trigger.setHttpMethod(emptyToNull(webHook.getHttpMethod()));
            trigger.setFormat(emptyToNull(webHook.getFormat()));
        }
        trigger.setPlugin(pluginToDataObject(notification.getPlugin()));
        return trigger;
    }

    private static NotificationSet notificationsToDomain(NotificationDO notificationDO) {
        if (notificationDO == null) {
            return null;
        }
        NotificationSet notifications = NotificationSet.builder()
            .onSuccess(triggerToDomain(notificationDO.getOnSuccess()))
            .onFailure(triggerToDomain(notificationDO.getOnFailure()))
            .onStart(triggerToDomain(notificationDO.getOnStart()))
            .build();
        return notifications.isEmpty() ? null : notifications;
    }

    private static Notification triggerToDomain(NotificationDO.Trigger trigger) {
        if (trigger == null) {
            return null;
        }
        Notification notification = new Notification();
        if (trigger.getEmail() != null) {
            notification.setEmail(EmailNotification.builder()
                .attachLog(Boolean.TRUE.equals(trigger.getEmail().getAttachLog()))
                .recipients(split(trigger.getEmail().getRecipients()))
                .subject(trigger.getEmail().getSubject())
                .build());
        }
        if (trigger.getWebHook() != null) {
            notification.setWebHook(WebHookNotification.builder()
                .urls(split(trigger.getWebHook().getUrls()))
                .httpMethod(trigger.getHttpMethod())
                .format(trigger.getFormat())
                .build());
        }
        notification.setPlugin(pluginToDomain(trigger.getPlugin()));
        return notification;
    }

    /**
     * 逗号拼接的列表拆分，去除空白与空项
     */
    static List<String> split(String joined) {
        if (!StringUtils.hasText(joined)) {
            return new ArrayList<>();
        }
        return Arrays.stream(joined.split(LIST_SEPARATOR))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private static Map<String, String> copy(Map<String, String> config) {
        return config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasLength(value) ? value : null;
    }
}
