package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * NodeFilterDO - 节点过滤器 &lt;nodefilters&gt;，作业和作业引用共用
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeFilterDO {

    @JacksonXmlProperty(localName = "excludeprecedence")
    private Boolean excludePrecedence;

    @JacksonXmlProperty(localName = "filter")
    private String filter;

    @JacksonXmlProperty(localName = "filterExclude")
    private String filterExclude;
}
