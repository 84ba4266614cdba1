package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

import java.util.Map;

/**
 * LogFilterDO - 日志过滤器 &lt;LogFilter type="..."&gt;&lt;config&gt;...&lt;/config&gt;&lt;/LogFilter&gt;
 * <p>
 * 配置以 key 为元素名、value 为元素内容。
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogFilterDO {

    @JacksonXmlProperty(isAttribute = true, localName = "type")
    private String type;

    @JacksonXmlProperty(localName = "config")
    private Map<String, String> config;
}
