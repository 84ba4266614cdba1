package com.tencent.jobdef.infrastructure.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * RundeckProperties - Rundeck 连接配置
 * <p>
 * 对应 application.yml 中的 rundeck.*，可由环境变量 RUNDECK_URL、RUNDECK_API_VERSION、
 * RUNDECK_AUTH_TOKEN 覆盖。url 或 auth-token 缺失时应用启动失败。
 * </p>
 *
 * @author jobdef
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rundeck")
public class RundeckProperties {

    public static final String AUTH_TOKEN_HEADER = "X-Rundeck-Auth-Token";

    /**
     * Rundeck 服务地址，如 http://localhost:4440
     */
    @NotBlank(message = "rundeck.url must be set")
    private String url;

    /**
     * API 版本
     */
    @Min(14)
    private int apiVersion = 14;

    /**
     * API 访问令牌
     */
    @NotBlank(message = "rundeck.auth-token must be set")
    private String authToken;

    /**
     * 获取 API 根地址，如 http://localhost:4440/api/14
     */
    public String getApiUrl() {
        String baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return baseUrl + "/api/" + apiVersion;
    }
}
