package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.CommandConfigDto;
import com.tencent.jobdef.client.dto.config.EmailConfigDto;
import com.tencent.jobdef.client.dto.config.ErrorHandlerConfigDto;
import com.tencent.jobdef.client.dto.config.JobConfigDto;
import com.tencent.jobdef.client.dto.config.JobRefConfigDto;
import com.tencent.jobdef.client.dto.config.LogFilterConfigDto;
import com.tencent.jobdef.client.dto.config.NodeFilterConfigDto;
import com.tencent.jobdef.client.dto.config.NotificationConfigDto;
import com.tencent.jobdef.client.dto.config.OptionConfigDto;
import com.tencent.jobdef.client.dto.config.PluginConfigDto;
import com.tencent.jobdef.client.dto.config.ScriptInterpreterConfigDto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用的作业配置样例
 */
public class JobConfigFixtures {

    /**
     * 覆盖全部配置块的作业
     */
    public static JobConfigDto fullJob() {
        Map<String, String> maskConfig = new LinkedHashMap<>();
        maskConfig.put("color", "red");
        maskConfig.put("replacement", "[SECURE]");

        return JobConfigDto.builder()
            .name("nightly-backup")
            .groupName("ops/backup")
            .projectName("ops")
            .description("Back up all databases")
            .executionEnabled(true)
            .logLevel("DEBUG")
            .allowConcurrentExecutions(true)
            .retry("2")
            .maxThreadCount(4)
            .continueOnError(true)
            .continueNextNodeOnError(true)
            .rankOrder("descending")
            .rankAttribute("nodename")
            .successOnEmptyNodeFilter(true)
            .preserveOptionsOrder(true)
            .commandOrderingStrategy("step-first")
            .nodeFilterQuery("tags: db")
            .nodeFilterExcludeQuery("name: db-legacy")
            .nodeFilterExcludePrecedence(true)
            .timeout("30m")
            .schedule("0 0 2 ? * MON-FRI *")
            .scheduleEnabled(true)
            .timeZone("Asia/Shanghai")
            .globalLogFilters(Collections.singletonList(LogFilterConfigDto.builder()
                .type("mask-passwords")
                .config(maskConfig)
                .build()))
            .options(Arrays.asList(
                OptionConfigDto.builder()
                    .name("env")
                    .label("Environment")
                    .defaultValue("prod")
                    .valueChoices(Arrays.asList("dev", "prod"))
                    .requirePredefinedChoice(true)
                    .required(true)
                    .isDate(false)
                    .build(),
                OptionConfigDto.builder()
                    .name("db_password")
                    .obscureInput(true)
                    .exposedToScripts(true)
                    .storagePath("keys/db/password")
                    .valueChoices(new ArrayList<>())
                    .isDate(false)
                    .build(),
                OptionConfigDto.builder()
                    .name("run_date")
                    .isDate(true)
                    .dateFormat("MM/DD/YYYY")
                    .valueChoices(new ArrayList<>())
                    .build()))
            .commands(Arrays.asList(scriptCommand(), jobRefCommand(), pluginCommand()))
            .notifications(Arrays.asList(
                NotificationConfigDto.builder()
                    .type("on_success")
                    .plugin(Collections.singletonList(plugin("SlackNotification", "channel", "#ops")))
                    .build(),
                NotificationConfigDto.builder()
                    .type("on_failure")
                    .email(Collections.singletonList(EmailConfigDto.builder()
                        .attachLog(true)
                        .recipients(Arrays.asList("ops@example.com", "dba@example.com"))
                        .subject("Backup failed")
                        .build()))
                    .webhookUrls(Collections.singletonList("https://hooks.example.com/backup"))
                    .webhookHttpMethod("post")
                    .webhookFormat("json")
                    .build()))
            .build();
    }

    /**
     * 只包含必填属性的作业
     */
    public static JobConfigDto minimalJob() {
        return JobConfigDto.builder()
            .name("hello")
            .projectName("demo")
            .description("Say hello")
            .commands(Collections.singletonList(CommandConfigDto.builder()
                .shellCommand("echo hello")
                .build()))
            .build();
    }

    public static CommandConfigDto scriptCommand() {
        return CommandConfigDto.builder()
            .description("run backup")
            .inlineScript("#!/bin/bash\n./backup.sh")
            .scriptFileArgs("--all")
            .keepGoingOnSuccess(true)
            .scriptInterpreter(Collections.singletonList(ScriptInterpreterConfigDto.builder()
                .invocationString("sudo -u backup bash")
                .argsQuoted(true)
                .build()))
            .errorHandler(Collections.singletonList(ErrorHandlerConfigDto.builder()
                .description("cleanup")
                .shellCommand("rm -rf /tmp/backup")
                .build()))
            .build();
    }

    public static CommandConfigDto jobRefCommand() {
        return CommandConfigDto.builder()
            .jobRefs(Collections.singletonList(JobRefConfigDto.builder()
                .name("verify-backup")
                .groupName("ops/backup")
                .runForEachNode(true)
                .args("-level full")
                .nodeFilters(Collections.singletonList(NodeFilterConfigDto.builder()
                    .filter("tags: db")
                    .excludeFilter("name: db-legacy")
                    .excludePrecedence(true)
                    .build()))
                .build()))
            .build();
    }

    public static CommandConfigDto pluginCommand() {
        return CommandConfigDto.builder()
            .stepPlugin(Collections.singletonList(plugin("http-step", "url", "https://example.com/done")))
            .errorHandler(Collections.singletonList(ErrorHandlerConfigDto.builder()
                .nodeStepPlugin(Collections.singletonList(plugin("retry-node", "count", "3")))
                .build()))
            .build();
    }

    public static PluginConfigDto plugin(String type, String key, String value) {
        Map<String, String> config = new LinkedHashMap<>();
        config.put(key, value);
        return PluginConfigDto.builder()
            .type(type)
            .config(config)
            .build();
    }

    public static <T> List<T> twice(T block) {
        return Arrays.asList(block, block);
    }
}
