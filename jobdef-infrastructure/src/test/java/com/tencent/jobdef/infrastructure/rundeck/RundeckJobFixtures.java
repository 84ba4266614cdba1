package com.tencent.jobdef.infrastructure.rundeck;

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
import com.tencent.jobdef.domain.schedule.ScheduleCodec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 测试用的领域作业样例
 */
public class RundeckJobFixtures {

    public static Job sampleJob() {
        Command backup = Command.builder()
            .description("run backup")
            .inlineScript("./backup.sh --all")
            .scriptFileArgs("--verbose")
            .keepGoingOnSuccess(true)
            .scriptInterpreter(ScriptInterpreter.builder()
                .invocationString("sudo -u backup bash")
                .argsQuoted(true)
                .build())
            .errorHandler(Command.builder()
                .shellCommand("rm -rf /tmp/backup")
                .build())
            .build();

        Command verify = Command.builder()
            .jobReference(JobReference.builder()
                .name("verify-backup")
                .group("ops/backup")
                .runForEachNode(true)
                .args("-level full")
                .nodeFilter(NodeFilter.builder()
                    .query("tags: db")
                    .excludePrecedence(true)
                    .build())
                .build())
            .build();

        Command notify = Command.builder()
            .stepPlugin(plugin("http-step", "url", "https://example.com/done"))
            .build();

        return Job.builder()
            .id("f1d2c3b4")
            .name("nightly-backup")
            .group("ops/backup")
            .project("ops")
            .description("Back up all databases")
            .executionEnabled(true)
            .scheduleEnabled(false)
            .timeZone("Asia/Shanghai")
            .timeout("30m")
            .logLevel("DEBUG")
            .allowConcurrentExecutions(true)
            .retry("2")
            .dispatch(Dispatch.builder()
                .threadCount(4)
                .keepGoing(true)
                .rankAttribute("nodename")
                .rankOrder("descending")
                .successOnEmptyNodeFilter(true)
                .build())
            .nodeFilter(NodeFilter.builder()
                .query("tags: db")
                .excludeQuery("name: db-legacy")
                .excludePrecedence(true)
                .build())
            .schedule(ScheduleCodec.decode("0 0 2 ? * MON-FRI *"))
            .commandSequence(CommandSequence.builder()
                .keepGoing(true)
                .strategy(OrderingStrategy.STEP_FIRST)
                .commands(new ArrayList<>(Arrays.asList(backup, verify, notify)))
                .globalLogFilters(new ArrayList<>(Collections.singletonList(LogFilter.builder()
                    .type("mask-passwords")
                    .config(config("color", "red"))
                    .build())))
                .build())
            .options(JobOptions.builder()
                .preserveOrder(true)
                .options(new ArrayList<>(Arrays.asList(
                    JobOption.builder()
                        .name("env")
                        .description("Target environment")
                        .defaultValue("prod")
                        .valueChoices(new ArrayList<>(Arrays.asList("dev", "prod")))
                        .requirePredefinedChoice(true)
                        .required(true)
                        .build(),
                    JobOption.builder()
                        .name("run_date")
                        .isDate(true)
                        .dateFormat("MM/DD/YYYY")
                        .build())))
                .build())
            .notifications(NotificationSet.builder()
                .onFailure(Notification.builder()
                    .email(EmailNotification.builder()
                        .attachLog(true)
                        .recipients(new ArrayList<>(Arrays.asList("ops@example.com", "dba@example.com")))
                        .subject("Backup failed")
                        .build())
                    .webHook(WebHookNotification.builder()
                        .urls(new ArrayList<>(Collections.singletonList("https://hooks.example.com/backup")))
                        .httpMethod("post")
                        .format("json")
                        .build())
                    .build())
                .onSuccess(Notification.builder()
                    .plugin(plugin("SlackNotification", "channel", "#ops"))
                    .build())
                .build())
            .build();
    }

    public static JobPlugin plugin(String type, String key, String value) {
        return JobPlugin.builder()
            .type(type)
            .config(config(key, value))
            .build();
    }

    private static Map<String, String> config(String key, String value) {
        Map<String, String> config = new LinkedHashMap<>();
        config.put(key, value);
        return config;
    }
}
