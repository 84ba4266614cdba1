package com.tencent.jobdef.adapter.web;

import com.tencent.jobdef.app.service.JobAppService;
import com.tencent.jobdef.client.dto.Response;
import com.tencent.jobdef.client.dto.SingleResponse;
import com.tencent.jobdef.client.dto.config.JobConfigDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * JobController - 作业接口
 * <p>
 * 请求与响应均为作业的扁平配置（snake_case JSON），/import 接收 YAML 文档。
 * </p>
 *
 * @author jobdef
 */
@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
public class JobController {

    private final JobAppService jobAppService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SingleResponse<JobConfigDto> create(@Valid @RequestBody JobConfigDto config) {
        return SingleResponse.of(jobAppService.createJob(config));
    }

    @GetMapping("/{id}")
    public SingleResponse<JobConfigDto> get(@PathVariable("id") String id) {
        return SingleResponse.of(jobAppService.readJob(id, null));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SingleResponse<JobConfigDto> update(@PathVariable("id") String id,
                                               @Valid @RequestBody JobConfigDto config) {
        return SingleResponse.of(jobAppService.updateJob(id, config));
    }

    @DeleteMapping("/{id}")
    public Response delete(@PathVariable("id") String id) {
        jobAppService.deleteJob(id);
        return Response.buildSuccess();
    }

    /**
     * 导入 YAML 作业文档，有 id 时更新，否则创建
     */
    @PostMapping(value = "/import", consumes = {"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN_VALUE})
    public SingleResponse<JobConfigDto> importYaml(@RequestBody String yamlContent) {
        return SingleResponse.of(jobAppService.submitJobYaml(yamlContent));
    }
}
