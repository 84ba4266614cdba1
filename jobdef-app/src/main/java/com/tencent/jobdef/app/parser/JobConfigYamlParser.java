package com.tencent.jobdef.app.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.tencent.jobdef.client.dto.config.JobConfigDto;
import org.springframework.stereotype.Component;

/**
 * JobConfigYamlParser - 作业配置 YAML 解析器
 * <p>
 * 文档结构与 {@link JobConfigDto} 一致，属性名为 snake_case。
 * 未知属性直接报错，因此错误处理器内部再写 error_handler 会在解析阶段被拒绝。
 * </p>
 *
 * @author jobdef
 */
@Component
public class JobConfigYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public JobConfigDto parse(String yamlContent) {
        if (yamlContent == null || yamlContent.trim().isEmpty()) {
            throw new JobConfigParseException("Job YAML document is empty", null);
        }
        try {
            return mapper.readValue(yamlContent, JobConfigDto.class);
        } catch (JsonProcessingException e) {
            throw new JobConfigParseException("Failed to parse job YAML: " + e.getOriginalMessage(), e);
        }
    }

    public String write(JobConfigDto config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new JobConfigParseException("Failed to write job YAML", e);
        }
    }
}
