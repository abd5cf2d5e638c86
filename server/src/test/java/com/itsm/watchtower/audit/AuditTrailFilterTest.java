package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.itsm.watchtower.audit.utils.RequestUtils;
import com.itsm.watchtower.models.audit.ResourceInfo;
import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.spi.AuditSink;
import com.itsm.watchtower.spimpl.authn.SimpleItsmUser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.context.SecurityContextImpl;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditTrailFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final PriorStateFetcher priorStateFetcher = mock(PriorStateFetcher.class);

    private final AuditTaskExecutor auditTaskExecutor = mock(AuditTaskExecutor.class);

    private final AuditSink auditSink = mock(AuditSink.class);

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final AuditTrailFilter auditTrailFilter = new AuditTrailFilter(priorStateFetcher, auditTaskExecutor, auditSink,
            new RequestUtils(false), objectMapper, meterRegistry, 1024);

    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @BeforeEach
    void setUp() {
        when(auditTaskExecutor.submit(any())).thenReturn(true);
        SecurityContextHolder.setContext(new SecurityContextImpl(UsernamePasswordAuthenticationToken.authenticated(
                new SimpleItsmUser(7L, "agent", Set.of("agent")), null, List.of())));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest jsonRequest(String method, String uri, String body) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setContentType("application/json");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        request.setRemoteAddr("10.1.2.3");
        request.addHeader("User-Agent", "junit");
        return request;
    }

    private AuditRecord writtenRecord() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(auditTaskExecutor).submit(task.capture());
        task.getValue().run();
        ArgumentCaptor<AuditRecord> auditRecord = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditSink).write(auditRecord.capture());
        return auditRecord.getValue();
    }

    @Test
    void auditsCreateAfterHandlerAndKeepsBodyReadable() throws Exception {
        // Arrange
        MockHttpServletRequest request = jsonRequest("POST", "/api/v1/incidents", "{\"title\": \"mail down\", \"token\": \"abc\"}");
        AtomicReference<String> bodySeenByHandler = new AtomicReference<>();
        FilterChain chain = (req, res) -> {
            bodySeenByHandler.set(new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
            verifyNoInteractions(auditTaskExecutor);
        };

        // Act
        auditTrailFilter.doFilter(request, response, chain);

        // Assert
        assertEquals("{\"title\": \"mail down\", \"token\": \"abc\"}", bodySeenByHandler.get());
        AuditRecord auditRecord = writtenRecord();
        assertEquals("create", auditRecord.getAction());
        assertEquals("incidents", auditRecord.getResourceType());
        assertNull(auditRecord.getResourceId());
        assertEquals(7L, auditRecord.getActorId());
        assertEquals("10.1.2.3", auditRecord.getIpAddress());
        assertEquals("junit", auditRecord.getUserAgent());
        assertTrue(auditRecord.isSecurityAction());
        assertEquals("mail down", auditRecord.getNewState().get("title").asText());
        assertEquals("[REDACTED]", auditRecord.getNewState().get("token").asText());
        verifyNoInteractions(priorStateFetcher);
    }

    @Test
    void resolvesPriorStateBeforeTheHandlerRuns() throws Exception {
        // Arrange
        JsonNode prior = objectMapper.readTree("{\"status\": \"open\", \"priority\": 3}");
        when(priorStateFetcher.fetch(new ResourceInfo("incidents", "INC-1"))).thenReturn(Optional.of(prior));
        MockHttpServletRequest request = jsonRequest("PUT", "/api/v1/incidents/INC-1", "{\"status\": \"resolved\", \"priority\": 3}");
        FilterChain chain = (req, res) -> verify(priorStateFetcher).fetch(new ResourceInfo("incidents", "INC-1"));

        // Act
        auditTrailFilter.doFilter(request, response, chain);

        // Assert
        AuditRecord auditRecord = writtenRecord();
        assertEquals("update", auditRecord.getAction());
        assertEquals("INC-1", auditRecord.getResourceId());
        assertFalse(auditRecord.isSecurityAction());
        assertNull(auditRecord.getPriorState());
        assertEquals("resolved", auditRecord.getDiff().changed().get("status").to().asText());
    }

    @Test
    void deleteWithoutBodyRecordsPriorSnapshot() throws Exception {
        JsonNode prior = objectMapper.readTree("{\"asset_tag\": \"A-1\"}");
        when(priorStateFetcher.fetch(new ResourceInfo("assets", "A-1"))).thenReturn(Optional.of(prior));
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/v1/assets/A-1");

        auditTrailFilter.doFilter(request, response, (req, res) -> { });

        AuditRecord auditRecord = writtenRecord();
        assertEquals("delete", auditRecord.getAction());
        assertEquals(prior, auditRecord.getPriorState());
        assertNull(auditRecord.getNewState());
    }

    @Test
    void skipsReadsAndExcludedPaths() throws Exception {
        AtomicInteger chainCalls = new AtomicInteger();
        FilterChain chain = (req, res) -> chainCalls.incrementAndGet();

        auditTrailFilter.doFilter(new MockHttpServletRequest("GET", "/api/v1/incidents"), response, chain);
        auditTrailFilter.doFilter(jsonRequest("POST", "/api/v1/audit-logs", "{}"), new MockHttpServletResponse(), chain);
        auditTrailFilter.doFilter(jsonRequest("POST", "/actuator/refresh", "{}"), new MockHttpServletResponse(), chain);

        assertEquals(3, chainCalls.get());
        verifyNoInteractions(auditTaskExecutor, priorStateFetcher);
    }

    @Test
    void auditsMalformedJsonAsText() throws Exception {
        MockHttpServletRequest request = jsonRequest("POST", "/api/v1/problems", "{not json");

        auditTrailFilter.doFilter(request, response, (req, res) -> { });

        assertEquals(TextNode.valueOf("{not json"), writtenRecord().getNewState());
    }

    @Test
    void doesNotCaptureBodiesThatAreNotJson() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/problems");
        request.setContentType("text/plain");
        request.setContent("plain".getBytes(StandardCharsets.UTF_8));
        AtomicReference<String> bodySeenByHandler = new AtomicReference<>();

        auditTrailFilter.doFilter(request, response, (req, res) ->
                bodySeenByHandler.set(new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8)));

        assertEquals("plain", bodySeenByHandler.get());
        assertNull(writtenRecord().getNewState());
    }

    @Test
    void doesNotCaptureBodiesOverTheLimitWhenLengthIsUnknown() throws Exception {
        // Arrange
        String body = "{\"description\": \"" + "x".repeat(2000) + "\"}";
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/incidents") {
            @Override
            public int getContentLength() {
                return -1;
            }

            @Override
            public long getContentLengthLong() {
                return -1;
            }
        };
        request.setContentType("application/json");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        AtomicReference<String> bodySeenByHandler = new AtomicReference<>();

        // Act
        auditTrailFilter.doFilter(request, response, (req, res) ->
                bodySeenByHandler.set(new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8)));

        // Assert
        assertEquals(body, bodySeenByHandler.get());
        AuditRecord auditRecord = writtenRecord();
        assertEquals("create", auditRecord.getAction());
        assertNull(auditRecord.getNewState());
    }

    @Test
    void auditsEvenWhenTheHandlerFails() {
        MockHttpServletRequest request = jsonRequest("POST", "/api/v1/releases", "{}");

        assertThrows(ServletException.class, () -> auditTrailFilter.doFilter(request, response, (req, res) -> {
            throw new ServletException("handler failed");
        }));

        verify(auditTaskExecutor).submit(any());
    }

    @Test
    void continuesUnauditedWhenPreparationFails() throws Exception {
        // Arrange
        when(priorStateFetcher.fetch(any())).thenThrow(new IllegalStateException("unexpected"));
        MockHttpServletRequest request = jsonRequest("PATCH", "/api/v1/changes/5", "{}");
        AtomicInteger chainCalls = new AtomicInteger();

        // Act
        auditTrailFilter.doFilter(request, response, (req, res) -> chainCalls.incrementAndGet());

        // Assert
        assertEquals(1, chainCalls.get());
        verifyNoInteractions(auditTaskExecutor);
        assertEquals(1.0, meterRegistry.counter(AuditConstants.AUDIT_ERROR_METRIC,
                AuditConstants.ACTION_TAG, "prepare", AuditConstants.EXCEPTION_TAG, "IllegalStateException").count());
    }

    @Test
    void auditsAnonymousRequestsWithoutActor() throws Exception {
        SecurityContextHolder.clearContext();
        MockHttpServletRequest request = jsonRequest("POST", "/api/v1/auth/login", "{\"username\": \"a\", \"password\": \"b\"}");

        auditTrailFilter.doFilter(request, response, (req, res) -> { });

        AuditRecord auditRecord = writtenRecord();
        assertNull(auditRecord.getActorId());
        assertTrue(auditRecord.isSecurityAction());
        assertEquals("[REDACTED]", auditRecord.getNewState().get("password").asText());
    }

    @Test
    void asyncRequestsAreAuditedWhenTheAsyncCycleCompletes() throws Exception {
        // Arrange
        MockHttpServletRequest request = jsonRequest("POST", "/api/v1/incidents", "{}");
        request.setAsyncSupported(true);

        // Act
        auditTrailFilter.doFilter(request, response, (req, res) -> req.startAsync());

        // Assert
        verifyNoInteractions(auditTaskExecutor);
        request.getAsyncContext().complete();
        verify(auditTaskExecutor, times(1)).submit(any());
    }
}
