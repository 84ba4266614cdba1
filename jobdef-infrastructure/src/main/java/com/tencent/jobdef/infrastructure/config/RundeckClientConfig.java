package com.tencent.jobdef.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RundeckClientConfig - Rundeck 客户端配置
 * <p>
 * 所有请求都携带 X-Rundeck-Auth-Token 头。
 * </p>
 *
 * @author jobdef
 */
@Configuration
@EnableConfigurationProperties(RundeckProperties.class)
public class RundeckClientConfig {

    @Bean
    public RestTemplate rundeckRestTemplate(RestTemplateBuilder builder, RundeckProperties properties) {
        return builder
                .defaultHeader(RundeckProperties.AUTH_TOKEN_HEADER, properties.getAuthToken())
                .build();
    }
}
