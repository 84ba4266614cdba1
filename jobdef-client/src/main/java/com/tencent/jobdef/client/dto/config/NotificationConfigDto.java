package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * NotificationConfigDto - notification 配置块
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationConfigDto {

    /**
     * on_success、on_failure 或 on_start
     */
    @NotBlank(message = "通知类型不能为空")
    private String type;

    /**
     * 只取第一个
     */
    @Valid
    private List<EmailConfigDto> email;

    private List<String> webhookUrls;

    /**
     * "get" 或 "post"
     */
    private String webhookHttpMethod;

    /**
     * "xml" 或 "json"
     */
    private String webhookFormat;

    /**
     * 至多一个
     */
    @Valid
    private List<PluginConfigDto> plugin;
}
