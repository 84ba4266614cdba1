package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * ContextDO - 作业上下文 &lt;context&gt;，包含所属项目与选项
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextDO {

    /**
     * 部分 Rundeck 版本读取时不返回
     */
    @JacksonXmlProperty(localName = "project")
    private String project;

    @JacksonXmlProperty(localName = "options")
    private OptionsDO options;
}
