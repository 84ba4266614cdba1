package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * ErrorHandlerConfigDto - 错误处理器步骤配置
 * <p>
 * 与 {@link CommandConfigDto} 相同，但没有 error_handler 属性，
 * 错误处理器因此无法再声明自己的错误处理器。
 * </p>
 *
 * @author jobdef
 */
@Data
@SuperBuilder
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorHandlerConfigDto extends StepConfigDto {
}
