package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * DispatchDO - 节点分发策略 &lt;dispatch&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DispatchDO {

    @JacksonXmlProperty(localName = "threadcount")
    private Integer threadCount;

    @JacksonXmlProperty(localName = "keepgoing")
    private Boolean keepGoing;

    @JacksonXmlProperty(localName = "rankAttribute")
    private String rankAttribute;

    @JacksonXmlProperty(localName = "rankOrder")
    private String rankOrder;

    @JacksonXmlProperty(localName = "successOnEmptyNodeFilter")
    private Boolean successOnEmptyNodeFilter;
}
