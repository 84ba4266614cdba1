package com.tencent.jobdef.client.dto.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JobRefConfigDto - 步骤中的 job 配置块（作业引用）
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobRefConfigDto {

    @NotBlank(message = "被引用作业名称不能为空")
    private String name;

    private String groupName;

    private boolean runForEachNode;

    private String args;

    /**
     * 节点过滤器覆盖，至多一个
     */
    private List<NodeFilterConfigDto> nodeFilters;
}
