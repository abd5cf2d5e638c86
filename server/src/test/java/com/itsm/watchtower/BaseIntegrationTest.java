package com.itsm.watchtower;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import com.itsm.watchtower.spi.repositories.ResourceStateRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Base class for tests running against the full web and security stack with mocked storage.
 */
@SpringBootTest(classes = TestWatchtowerApplication.class)
@AutoConfigureMockMvc
public abstract class BaseIntegrationTest {

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @MockBean
    protected AuditRecordRepository auditRecordRepository;

    @MockBean
    protected ResourceStateRepository resourceStateRepository;
}
