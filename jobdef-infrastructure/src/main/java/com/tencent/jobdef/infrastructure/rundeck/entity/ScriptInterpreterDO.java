package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import lombok.Data;

/**
 * ScriptInterpreterDO - &lt;scriptinterpreter argsquoted="true"&gt;sudo bash&lt;/scriptinterpreter&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScriptInterpreterDO {

    @JacksonXmlProperty(isAttribute = true, localName = "argsquoted")
    private Boolean argsQuoted;

    @JacksonXmlText
    private String invocationString;
}
