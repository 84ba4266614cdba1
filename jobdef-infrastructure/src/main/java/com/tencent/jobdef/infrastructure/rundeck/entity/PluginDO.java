package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * PluginDO - 插件 &lt;step-plugin&gt;、&lt;node-step-plugin&gt;、通知 &lt;plugin&gt;
 * <p>
 * 配置为 &lt;configuration&gt;&lt;entry key="..." value="..."/&gt;&lt;/configuration&gt;。
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluginDO {

    @JacksonXmlProperty(isAttribute = true, localName = "type")
    private String type;

    @JacksonXmlElementWrapper(localName = "configuration")
    @JacksonXmlProperty(localName = "entry")
    private List<Entry> configuration;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        @JacksonXmlProperty(isAttribute = true, localName = "key")
        private String key;
        @JacksonXmlProperty(isAttribute = true, localName = "value")
        private String value;
    }
}
