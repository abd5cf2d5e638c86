package com.itsm.watchtower.app;

import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "audit.derby.url=jdbc:derby:memory:watchtower-app-test;create=true")
@AutoConfigureMockMvc
class WatchtowerApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AuditRecordRepository auditRecordRepository;

    @Test
    void auditsMutationsIntoDerbyAndServesThemBack() throws Exception {
        // no entity routes are installed, the request still reaches the audit trail
        mockMvc.perform(post("/api/v1/incidents")
                        .with(httpBasic("admin", "admin"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"printer on fire\", \"password\": \"p\"}"))
                .andExpect(status().isNotFound());

        assertTrue(waitForRecords(1, Duration.ofSeconds(5)), "audit record should be stored");

        mockMvc.perform(get("/api/v1/audit-logs").with(httpBasic("admin", "admin")).param("resourceType", "incidents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.items[0].actorId").value(1))
                .andExpect(jsonPath("$.data.items[0].securityAction").value(true))
                .andExpect(jsonPath("$.data.items[0].newState.password").value("[REDACTED]"));

        assertEquals(1, auditRecordRepository.count(AuditLogFilter.none()));
    }

    private boolean waitForRecords(long expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (auditRecordRepository.count(AuditLogFilter.none()) >= expected) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
