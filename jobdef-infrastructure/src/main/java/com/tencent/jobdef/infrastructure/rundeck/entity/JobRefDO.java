package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * JobRefDO - 作业引用 &lt;jobref&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobRefDO {

    @JacksonXmlProperty(isAttribute = true, localName = "name")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "group")
    private String group;

    /**
     * 对应 run_for_each_node
     */
    @JacksonXmlProperty(isAttribute = true, localName = "nodeStep")
    private Boolean nodeStep;

    @JacksonXmlProperty(localName = "arg")
    private Arg arg;

    @JacksonXmlProperty(localName = "nodefilters")
    private NodeFilterDO nodeFilter;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Arg {
        @JacksonXmlProperty(isAttribute = true, localName = "line")
        private String line;
    }
}
