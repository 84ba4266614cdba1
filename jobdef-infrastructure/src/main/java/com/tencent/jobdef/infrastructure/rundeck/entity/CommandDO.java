package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * CommandDO - 步骤 &lt;command&gt;，同时用于错误处理器 &lt;errorhandler&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommandDO {

    @JacksonXmlProperty(isAttribute = true, localName = "keepgoingOnSuccess")
    private Boolean keepGoingOnSuccess;

    @JacksonXmlProperty(localName = "description")
    private String description;

    /**
     * shell 命令
     */
    @JacksonXmlProperty(localName = "exec")
    private String exec;

    /**
     * 内联脚本
     */
    @JacksonXmlProperty(localName = "script")
    private String script;

    @JacksonXmlProperty(localName = "scriptfile")
    private String scriptFile;

    @JacksonXmlProperty(localName = "scriptargs")
    private String scriptArgs;

    @JacksonXmlProperty(localName = "scriptinterpreter")
    private ScriptInterpreterDO scriptInterpreter;

    @JacksonXmlProperty(localName = "jobref")
    private JobRefDO jobRef;

    @JacksonXmlProperty(localName = "step-plugin")
    private PluginDO stepPlugin;

    @JacksonXmlProperty(localName = "node-step-plugin")
    private PluginDO nodeStepPlugin;

    @JacksonXmlProperty(localName = "errorhandler")
    private CommandDO errorHandler;
}
