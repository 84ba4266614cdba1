package com.tencent.jobdef.domain.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LogFilter - 全局日志过滤器
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogFilter {

    /**
     * 过滤器插件类型，如 "mask-passwords"
     */
    private String type;

    /**
     * 插件配置，不做类型解析
     */
    @Builder.Default
    private Map<String, String> config = new LinkedHashMap<>();
}
