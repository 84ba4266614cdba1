package com.tencent.jobdef.app.service;

import com.tencent.jobdef.app.parser.JobConfigYamlParser;
import com.tencent.jobdef.app.translator.JobAssembler;
import com.tencent.jobdef.client.dto.config.JobConfigDto;
import com.tencent.jobdef.domain.exception.JobNotFoundException;
import com.tencent.jobdef.domain.gateway.JobGateway;
import com.tencent.jobdef.domain.job.Job;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * JobAppService - 作业应用服务
 * <p>
 * 编排作业的创建、读取、更新、删除。写入后总是重新读取远程作业，
 * 返回远程系统实际保存的配置。
 * </p>
 *
 * @author jobdef
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAppService {

    private final JobGateway jobGateway;
    private final JobConfigYamlParser parser;

    public JobConfigDto createJob(JobConfigDto config) {
        Job job = JobAssembler.toDomain(config);
        job.setId(null);

        String id = jobGateway.createJob(job);
        log.info("Created job [{}] in project [{}], id: {}", job.getName(), job.getProject(), id);

        return readJob(id, config);
    }

    public JobConfigDto updateJob(String id, JobConfigDto config) {
        Job job = JobAssembler.toDomain(config);
        job.setId(id);

        String updatedId = jobGateway.updateJob(job);
        log.info("Updated job [{}], id: {}", job.getName(), updatedId);

        return readJob(updatedId, config);
    }

    /**
     * 读取远程作业并写回 current
     *
     * @param current 当前的扁平配置，可为 null
     * @throws JobNotFoundException 远程不存在该作业
     */
    public JobConfigDto readJob(String id, JobConfigDto current) {
        Job job = jobGateway.getJob(id)
            .orElseThrow(() -> new JobNotFoundException(id));
        return JobAssembler.toConfig(job, current != null ? current : new JobConfigDto());
    }

    public void deleteJob(String id) {
        jobGateway.deleteJob(id);
        log.info("Deleted job: {}", id);
    }

    /**
     * 提交 YAML 作业文档：没有 id 时创建，有 id 时更新
     */
    public JobConfigDto submitJobYaml(String yamlContent) {
        JobConfigDto config = parser.parse(yamlContent);
        log.info("Submitting job document: {}", config.getName());

        if (config.getId() == null || config.getId().isEmpty()) {
            return createJob(config);
        }
        return updateJob(config.getId(), config);
    }
}
