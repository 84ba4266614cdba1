package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * StepConfigDto - 步骤配置的公共属性
 * <p>
 * 配置结构无法表达递归，因此步骤拆成两种形状：
 * {@link CommandConfigDto}（带 error_handler）与
 * {@link ErrorHandlerConfigDto}（不带 error_handler），其余属性完全相同。
 * </p>
 *
 * @author jobdef
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class StepConfigDto {

    private String description;

    private String shellCommand;

    private String inlineScript;

    private String scriptFile;

    private String scriptFileArgs;

    /**
     * 至多一个
     */
    @Valid
    private List<ScriptInterpreterConfigDto> scriptInterpreter;

    /**
     * 作业引用，至多一个
     */
    @Valid
    @JsonProperty("job")
    private List<JobRefConfigDto> jobRefs;

    /**
     * 至多一个
     */
    @Valid
    private List<PluginConfigDto> stepPlugin;

    /**
     * 至多一个
     */
    @Valid
    private List<PluginConfigDto> nodeStepPlugin;

    private boolean keepGoingOnSuccess;
}
