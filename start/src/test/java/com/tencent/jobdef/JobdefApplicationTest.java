package com.tencent.jobdef;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tencent.jobdef.adapter.web.JobController;
import com.tencent.jobdef.domain.gateway.JobGateway;
import com.tencent.jobdef.infrastructure.config.RundeckProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 应用上下文启动测试
 */
@SpringBootTest(properties = {
        "rundeck.url=http://localhost:4440/",
        "rundeck.auth-token=test-token"
})
class JobdefApplicationTest {

    @Autowired
    private JobController jobController;

    @Autowired
    private JobGateway jobGateway;

    @Autowired
    private RundeckProperties rundeckProperties;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void testContextLoads() {
        assertNotNull(jobController);
        assertNotNull(jobGateway);
        assertEquals(14, rundeckProperties.getApiVersion());
        assertEquals("http://localhost:4440/api/14", rundeckProperties.getApiUrl());
    }

    @Test
    void testJsonRejectsUnknownAttributes() {
        assertTrue(objectMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }
}
