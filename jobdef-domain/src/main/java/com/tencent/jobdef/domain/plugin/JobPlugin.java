package com.tencent.jobdef.domain.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JobPlugin - 插件引用（值对象）
 * <p>
 * 用于步骤插件、节点步骤插件和通知插件。插件配置统一视为字符串键值对，
 * 不解析具体插件的配置结构。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPlugin {

    /**
     * 插件类型标识
     */
    private String type;

    /**
     * 插件配置
     */
    @Builder.Default
    private Map<String, String> config = new LinkedHashMap<>();
}
