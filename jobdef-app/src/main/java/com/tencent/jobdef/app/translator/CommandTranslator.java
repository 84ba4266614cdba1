package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.CommandConfigDto;
import com.tencent.jobdef.client.dto.config.ErrorHandlerConfigDto;
import com.tencent.jobdef.client.dto.config.JobRefConfigDto;
import com.tencent.jobdef.client.dto.config.NodeFilterConfigDto;
import com.tencent.jobdef.client.dto.config.PluginConfigDto;
import com.tencent.jobdef.client.dto.config.ScriptInterpreterConfigDto;
import com.tencent.jobdef.client.dto.config.StepConfigDto;
import com.tencent.jobdef.domain.command.Command;
import com.tencent.jobdef.domain.command.JobReference;
import com.tencent.jobdef.domain.command.ScriptInterpreter;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import com.tencent.jobdef.domain.job.NodeFilter;
import com.tencent.jobdef.domain.plugin.JobPlugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CommandTranslator - 步骤翻译器
 * <p>
 * 配置中的步骤分为两种形状：顶层的 {@link CommandConfigDto} 和不能再嵌套的
 * {@link ErrorHandlerConfigDto}。领域侧统一为递归的 {@link Command}，
 * 但错误处理器自身永远没有错误处理器。
 * </p>
 * <p>
 * 所有"至多一个"的配置块长度超过 1 时抛出 TOO_MANY_BLOCKS，空列表视为未设置；
 * 反向转换时未设置的块输出 null，不输出空列表。
 * </p>
 *
 * @author jobdef
 */
public final class CommandTranslator {

    static final String ERROR_HANDLER = "error_handler";
    static final String SCRIPT_INTERPRETER = "script_interpreter";
    static final String JOB = "job";
    static final String STEP_PLUGIN = "step_plugin";
    static final String NODE_STEP_PLUGIN = "node_step_plugin";
    static final String NODE_FILTER = "node_filters";

    private CommandTranslator() {
    }

    public static List<Command> toDomain(List<CommandConfigDto> configs) {
        List<Command> commands = new ArrayList<>();
        if (configs == null) {
            return commands;
        }
        for (CommandConfigDto config : configs) {
            commands.add(toDomain(config));
        }
        return commands;
    }

    /**
     * 顶层步骤转领域对象，error_handler 至多递归一层
     */
    public static Command toDomain(CommandConfigDto config) {
        ErrorHandlerConfigDto errorHandler = single(config.getErrorHandler(), ERROR_HANDLER);
        Command command = stepToDomain(config);
        if (errorHandler != null) {
            command.setErrorHandler(toDomain(errorHandler));
        }
        return command;
    }

    /**
     * 错误处理器转领域对象，结果的 errorHandler 始终为 null
     */
    public static Command toDomain(ErrorHandlerConfigDto config) {
        return stepToDomain(config);
    }

    public static List<CommandConfigDto> toConfig(List<Command> commands) {
        List<CommandConfigDto> configs = new ArrayList<>();
        if (commands == null) {
            return configs;
        }
        for (Command command : commands) {
            configs.add(toConfig(command));
        }
        return configs;
    }

    public static CommandConfigDto toConfig(Command command) {
        CommandConfigDto config = stepToConfig(command, new CommandConfigDto());
        if (command.getErrorHandler() != null) {
            config.setErrorHandler(Collections.singletonList(toErrorHandlerConfig(command.getErrorHandler())));
        }
        return config;
    }

    /**
     * 错误处理器转配置块；入参自身的 errorHandler 不会被输出
     */
    public static ErrorHandlerConfigDto toErrorHandlerConfig(Command command) {
        return stepToConfig(command, new ErrorHandlerConfigDto());
    }

    private static Command stepToDomain(StepConfigDto config) {
        ScriptInterpreterConfigDto interpreter = single(config.getScriptInterpreter(), SCRIPT_INTERPRETER);
        JobRefConfigDto jobRef = single(config.getJobRefs(), JOB);
        PluginConfigDto stepPlugin = single(config.getStepPlugin(), STEP_PLUGIN);
        PluginConfigDto nodeStepPlugin = single(config.getNodeStepPlugin(), NODE_STEP_PLUGIN);

        return Command.builder()
            .description(config.getDescription())
            .shellCommand(config.getShellCommand())
            .inlineScript(config.getInlineScript())
            .scriptFile(config.getScriptFile())
            .scriptFileArgs(config.getScriptFileArgs())
            .keepGoingOnSuccess(config.isKeepGoingOnSuccess())
            .scriptInterpreter(interpreter == null ? null : ScriptInterpreter.builder()
                .invocationString(interpreter.getInvocationString())
                .argsQuoted(interpreter.isArgsQuoted())
                .build())
            .jobReference(jobRef == null ? null : jobRefToDomain(jobRef))
            .stepPlugin(pluginToDomain(stepPlugin))
            .nodeStepPlugin(pluginToDomain(nodeStepPlugin))
            .build();
    }

    private static <T extends StepConfigDto> T stepToConfig(Command command, T config) {
        config.setDescription(command.getDescription());
        config.setShellCommand(command.getShellCommand());
        config.setInlineScript(command.getInlineScript());
        config.setScriptFile(command.getScriptFile());
        config.setScriptFileArgs(command.getScriptFileArgs());
        config.setKeepGoingOnSuccess(command.isKeepGoingOnSuccess());

        ScriptInterpreter interpreter = command.getScriptInterpreter();
        if (interpreter != null) {
            config.setScriptInterpreter(Collections.singletonList(ScriptInterpreterConfigDto.builder()
                .invocationString(interpreter.getInvocationString())
                .argsQuoted(interpreter.isArgsQuoted())
                .build()));
        }
        if (command.getJobReference() != null) {
            config.setJobRefs(Collections.singletonList(jobRefToConfig(command.getJobReference())));
        }
        if (command.getStepPlugin() != null) {
            config.setStepPlugin(Collections.singletonList(pluginToConfig(command.getStepPlugin())));
        }
        if (command.getNodeStepPlugin() != null) {
            config.setNodeStepPlugin(Collections.singletonList(pluginToConfig(command.getNodeStepPlugin())));
        }
        return config;
    }

    private static JobReference jobRefToDomain(JobRefConfigDto config) {
        NodeFilterConfigDto filter = single(config.getNodeFilters(), NODE_FILTER);
        return JobReference.builder()
            .name(config.getName())
            .group(config.getGroupName())
            .runForEachNode(config.isRunForEachNode())
            .args(config.getArgs())
            .nodeFilter(filter == null ? null : NodeFilter.builder()
                .query(filter.getFilter())
                .excludeQuery(filter.getExcludeFilter())
                .excludePrecedence(filter.isExcludePrecedence())
                .build())
            .build();
    }

    private static JobRefConfigDto jobRefToConfig(JobReference jobRef) {
        JobRefConfigDto config = JobRefConfigDto.builder()
            .name(jobRef.getName())
            .groupName(jobRef.getGroup())
            .runForEachNode(jobRef.isRunForEachNode())
            .args(jobRef.getArgs())
            .build();
        NodeFilter filter = jobRef.getNodeFilter();
        if (filter != null) {
            config.setNodeFilters(Collections.singletonList(NodeFilterConfigDto.builder()
                .filter(filter.getQuery())
                .excludeFilter(filter.getExcludeQuery())
                .excludePrecedence(filter.isExcludePrecedence())
                .build()));
        }
        return config;
    }

    static JobPlugin pluginToDomain(PluginConfigDto config) {
        if (config == null) {
            return null;
        }
        return JobPlugin.builder()
            .type(config.getType())
            .config(copy(config.getConfig()))
            .build();
    }

    static PluginConfigDto pluginToConfig(JobPlugin plugin) {
        return PluginConfigDto.builder()
            .type(plugin.getType())
            .config(copy(plugin.getConfig()))
            .build();
    }

    /**
     * 取"至多一个"配置块中的唯一元素
     *
     * @return 列表为空时返回 null
     * @throws JobTranslationException 元素超过一个
     */
    static <T> T single(List<T> blocks, String blockName) {
        if (blocks == null || blocks.isEmpty()) {
            return null;
        }
        if (blocks.size() > 1) {
            throw JobTranslationException.tooManyBlocks(blockName);
        }
        return blocks.get(0);
    }

    static Map<String, String> copy(Map<String, String> config) {
        return config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }
}
