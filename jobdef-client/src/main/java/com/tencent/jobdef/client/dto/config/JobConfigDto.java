package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JobConfigDto - 作业的扁平配置视图
 * <p>
 * 属性名与配置文件中的 snake_case 名称一致。列表形式的配置块保持声明顺序；
 * 表示"至多一个"的配置块同样是列表，长度超过 1 时在翻译阶段报错。
 * 默认值与资源定义保持一致。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobConfigDto {

    /**
     * 远程系统分配的作业 ID，创建前为空
     */
    private String id;

    @NotBlank(message = "作业名称不能为空")
    private String name;

    private String groupName;

    @NotBlank(message = "项目名称不能为空")
    private String projectName;

    @NotBlank(message = "作业描述不能为空")
    private String description;

    @Builder.Default
    private boolean executionEnabled = true;

    @Builder.Default
    private String logLevel = "INFO";

    private boolean allowConcurrentExecutions;

    private String retry;

    @Builder.Default
    private int maxThreadCount = 1;

    private boolean continueOnError;

    private boolean continueNextNodeOnError;

    @Builder.Default
    private String rankOrder = "ascending";

    private String rankAttribute;

    private boolean successOnEmptyNodeFilter;

    private boolean preserveOptionsOrder;

    @Builder.Default
    private String commandOrderingStrategy = "node-first";

    private String nodeFilterQuery;

    private String nodeFilterExcludeQuery;

    private boolean nodeFilterExcludePrecedence;

    private String timeout;

    /**
     * 7 段 cron 表达式，如 "0 0 12 ? * MON-FRI *"
     */
    private String schedule;

    @Builder.Default
    private boolean scheduleEnabled = true;

    private String timeZone;

    /**
     * 通知块，最多 3 个，每种触发类型一个
     */
    @Valid
    @JsonProperty("notification")
    private List<NotificationConfigDto> notifications;

    @Valid
    @JsonProperty("option")
    private List<OptionConfigDto> options;

    @Valid
    @JsonProperty("global_log_filter")
    private List<LogFilterConfigDto> globalLogFilters;

    @Valid
    @NotNull(message = "命令列表不能为空")
    @JsonProperty("command")
    private List<CommandConfigDto> commands;
}
