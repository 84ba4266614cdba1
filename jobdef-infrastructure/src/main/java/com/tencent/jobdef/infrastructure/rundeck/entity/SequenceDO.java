package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

import java.util.List;

/**
 * SequenceDO - 命令序列 &lt;sequence&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SequenceDO {

    @JacksonXmlProperty(isAttribute = true, localName = "keepgoing")
    private Boolean keepGoing;

    @JacksonXmlProperty(isAttribute = true, localName = "strategy")
    private String strategy;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "command")
    private List<CommandDO> commands;

    /**
     * 全局日志过滤器，位于 &lt;pluginConfig&gt; 下
     */
    @JacksonXmlElementWrapper(localName = "pluginConfig")
    @JacksonXmlProperty(localName = "LogFilter")
    private List<LogFilterDO> logFilters;
}
