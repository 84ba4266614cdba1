package com.tencent.jobdef.adapter.web;

import com.tencent.jobdef.app.parser.JobConfigYamlParser;
import com.tencent.jobdef.app.service.JobAppService;
import com.tencent.jobdef.domain.exception.JobGatewayException;
import com.tencent.jobdef.domain.gateway.JobGateway;
import com.tencent.jobdef.domain.job.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class JobControllerTest {

    private static final String MINIMAL_JOB = "{"
        + "\"name\":\"hello\","
        + "\"project_name\":\"demo\","
        + "\"description\":\"Say hello\","
        + "\"command\":[{\"shell_command\":\"echo hello\"}]"
        + "}";

    private Map<String, Job> remoteJobs;
    private boolean remoteDown;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        remoteJobs = new LinkedHashMap<>();
        remoteDown = false;

        JobGateway gateway = new JobGateway() {
            @Override
            public Optional<Job> getJob(String id) {
                checkRemote();
                return Optional.ofNullable(remoteJobs.get(id));
            }

            @Override
            public String createJob(Job job) {
                checkRemote();
                job.setId("job-" + (remoteJobs.size() + 1));
                remoteJobs.put(job.getId(), job);
                return job.getId();
            }

            @Override
            public String updateJob(Job job) {
                checkRemote();
                remoteJobs.put(job.getId(), job);
                return job.getId();
            }

            @Override
            public void deleteJob(String id) {
                checkRemote();
                remoteJobs.remove(id);
            }
        };

        JobAppService jobAppService = new JobAppService(gateway, new JobConfigYamlParser());
        // 与 application.yml 中 spring.jackson.deserialization.fail-on-unknown-properties 保持一致
        mockMvc = MockMvcBuilders.standaloneSetup(new JobController(jobAppService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new StringHttpMessageConverter(),
                new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                    .failOnUnknownProperties(true)
                    .build()))
            .build();
    }

    private void checkRemote() {
        if (remoteDown) {
            throw new JobGatewayException("Connection refused");
        }
    }

    @Test
    void testCreateJob() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.id").value("job-1"))
            .andExpect(jsonPath("$.data.project_name").value("demo"))
            .andExpect(jsonPath("$.data.max_thread_count").value(1))
            .andExpect(jsonPath("$.data.command[0].shell_command").value("echo hello"));

        assertEquals(1, remoteJobs.size());
    }

    @Test
    void testCreateJobValidation() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"hello\",\"command\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errCode").value("VALIDATION_ERROR"));

        assertTrue(remoteJobs.isEmpty());
    }

    @Test
    void testCreateJobTranslationError() throws Exception {
        String body = MINIMAL_JOB.replace("\"command\":",
            "\"schedule\":\"0 0 12 15 * MON *\",\"command\":");

        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errCode").value("INVALID_SCHEDULE_FIELDS"))
            .andExpect(jsonPath("$.errMessage").value(containsString("must be '?'")));
    }

    @Test
    void testMalformedJson() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"name\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errCode").value("PARSE_ERROR"));
    }

    @Test
    void testCreateJobRejectsUnknownAttribute() throws Exception {
        String nestedHandler = MINIMAL_JOB.replace("{\"shell_command\":\"echo hello\"}",
            "{\"shell_command\":\"a\",\"error_handler\":[{\"shell_command\":\"b\","
                + "\"error_handler\":[{\"shell_command\":\"c\"}]}]}");

        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(nestedHandler))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errCode").value("PARSE_ERROR"));

        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB.replace("\"name\":", "\"bogus_attr\":1,\"name\":")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errCode").value("PARSE_ERROR"));

        assertTrue(remoteJobs.isEmpty());
    }

    @Test
    void testGetJob() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/jobs/job-1").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.name").value("hello"))
            .andExpect(jsonPath("$.data.command_ordering_strategy").value("node-first"));
    }

    @Test
    void testGetJobNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/nope").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errCode").value("JOB_NOT_FOUND"));
    }

    @Test
    void testUpdateJob() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB))
            .andExpect(status().isOk());

        mockMvc.perform(put("/api/jobs/job-1")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB.replace("Say hello", "Say hello again")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value("job-1"))
            .andExpect(jsonPath("$.data.description").value("Say hello again"));
    }

    @Test
    void testDeleteJob() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(MINIMAL_JOB))
            .andExpect(status().isOk());

        mockMvc.perform(delete("/api/jobs/job-1").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        assertTrue(remoteJobs.isEmpty());
    }

    @Test
    void testRemoteFailure() throws Exception {
        remoteDown = true;

        mockMvc.perform(get("/api/jobs/job-1").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.errCode").value("GATEWAY_ERROR"))
            .andExpect(jsonPath("$.errMessage").value("Connection refused"));
    }

    @Test
    void testImportYaml() throws Exception {
        String yaml = "name: hello\n"
            + "project_name: demo\n"
            + "description: Say hello\n"
            + "command:\n"
            + "  - shell_command: echo hello\n"
            + "    script_interpreter:\n"
            + "      - invocation_string: bash\n"
            + "      - invocation_string: sh\n";

        mockMvc.perform(post("/api/jobs/import")
                .contentType("application/yaml")
                .accept(MediaType.APPLICATION_JSON)
                .content(yaml))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errCode").value("TOO_MANY_BLOCKS"));

        mockMvc.perform(post("/api/jobs/import")
                .contentType("application/yaml")
                .accept(MediaType.APPLICATION_JSON)
                .content(yaml.substring(0, yaml.indexOf("    script_interpreter"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value("job-1"));
    }

    @Test
    void testImportInvalidYaml() throws Exception {
        mockMvc.perform(post("/api/jobs/import")
                .contentType(MediaType.TEXT_PLAIN)
                .accept(MediaType.APPLICATION_JSON)
                .content("name: hello\nnot_a_field: true\n"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errCode").value("PARSE_ERROR"));
    }
}
