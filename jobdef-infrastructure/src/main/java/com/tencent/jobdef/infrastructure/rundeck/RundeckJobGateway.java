package com.tencent.jobdef.infrastructure.rundeck;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.tencent.jobdef.domain.exception.JobGatewayException;
import com.tencent.jobdef.domain.gateway.JobGateway;
import com.tencent.jobdef.domain.job.Job;
import com.tencent.jobdef.infrastructure.config.RundeckProperties;
import com.tencent.jobdef.infrastructure.rundeck.converter.JobDocumentConverter;
import com.tencent.jobdef.infrastructure.rundeck.entity.ImportResultDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.JobDO;
import com.tencent.jobdef.infrastructure.rundeck.entity.JobListDO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collections;
import java.util.Optional;

/**
 * RundeckJobGateway - 基于 Rundeck HTTP API 的作业网关
 * <p>
 * 作业以 XML 文档读写：读取使用 GET /job/{id}，创建与更新都通过
 * /project/{project}/jobs/import 导入（dupeOption 分别为 create 与 update），
 * 删除使用 DELETE /job/{id}。不做重试、缓存与超时控制。
 * </p>
 *
 * @author jobdef
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RundeckJobGateway implements JobGateway {

    static final String DUPE_OPTION_CREATE = "create";
    static final String DUPE_OPTION_UPDATE = "update";

    private final RestTemplate restTemplate;
    private final RundeckProperties properties;

    private final XmlMapper xmlMapper = createXmlMapper();

    @Override
    public Optional<Job> getJob(String id) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getApiUrl())
            .pathSegment("job", id)
            .build()
            .encode()
            .toUri();
        log.debug("Fetching Rundeck job: GET {}", uri);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_XML));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Rundeck job not found: {}", id);
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Failed to get Rundeck job [{}]", id, e);
            throw new JobGatewayException("Failed to get job " + id + ": " + e.getMessage(), e);
        }

        if (!StringUtils.hasText(response.getBody())) {
            return Optional.empty();
        }
        JobListDO jobList = readJobList(response.getBody());
        if (jobList.getJobs() == null || jobList.getJobs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(JobDocumentConverter.toDomain(jobList.getJobs().get(0)));
    }

    @Override
    public String createJob(Job job) {
        return importJob(job, DUPE_OPTION_CREATE);
    }

    @Override
    public String updateJob(Job job) {
        if (!StringUtils.hasText(job.getId())) {
            throw new IllegalArgumentException("Job id is required for update. Job: " + job.getName());
        }
        return importJob(job, DUPE_OPTION_UPDATE);
    }

    @Override
    public void deleteJob(String id) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getApiUrl())
            .pathSegment("job", id)
            .build()
            .encode()
            .toUri();
        log.info("Deleting Rundeck job: DELETE {}", uri);

        try {
            restTemplate.exchange(uri, HttpMethod.DELETE, HttpEntity.EMPTY, Void.class);
        } catch (RestClientException e) {
            log.error("Failed to delete Rundeck job [{}]", id, e);
            throw new JobGatewayException("Failed to delete job " + id + ": " + e.getMessage(), e);
        }
    }

    private String importJob(Job job, String dupeOption) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getApiUrl())
            .pathSegment("project", job.getProject(), "jobs", "import")
            .queryParam("fileformat", "xml")
            .queryParam("dupeOption", dupeOption)
            .queryParam("uuidOption", "preserve")
            .build()
            .encode()
            .toUri();
        log.info("Importing Rundeck job [{}] with dupeOption={}: POST {}", job.getName(), dupeOption, uri);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_XML);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        HttpEntity<String> request = new HttpEntity<>(writeJobList(job), headers);

        ImportResultDO result;
        try {
            result = restTemplate.exchange(uri, HttpMethod.POST, request, ImportResultDO.class).getBody();
        } catch (RestClientException e) {
            log.error("Failed to import Rundeck job [{}]", job.getName(), e);
            throw new JobGatewayException("Failed to import job " + job.getName() + ": " + e.getMessage(), e);
        }

        if (result == null) {
            throw new JobGatewayException("Empty import result for job " + job.getName());
        }
        if (result.getFailed() != null && !result.getFailed().isEmpty()) {
            String error = result.getFailed().get(0).getError();
            log.error("Rundeck rejected job [{}]: {}", job.getName(), error);
            throw new JobGatewayException("Failed to import job " + job.getName() + ": " + error);
        }
        if (result.getSucceeded() == null || result.getSucceeded().isEmpty()) {
            throw new JobGatewayException("Job " + job.getName() + " was not imported");
        }
        return result.getSucceeded().get(0).getId();
    }

    String writeJobList(Job job) {
        JobDO jobDO = JobDocumentConverter.toDataObject(job);
        try {
            return xmlMapper.writeValueAsString(new JobListDO(Collections.singletonList(jobDO)));
        } catch (JsonProcessingException e) {
            throw new JobGatewayException("Failed to write job document for " + job.getName(), e);
        }
    }

    private JobListDO readJobList(String xml) {
        try {
            return xmlMapper.readValue(xml, JobListDO.class);
        } catch (JsonProcessingException e) {
            throw new JobGatewayException("Failed to read job document: " + e.getOriginalMessage(), e);
        }
    }

    private static XmlMapper createXmlMapper() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        return mapper;
    }
}
