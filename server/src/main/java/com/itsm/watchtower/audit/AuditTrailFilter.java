package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.itsm.watchtower.audit.utils.AuditActionClassifier;
import com.itsm.watchtower.audit.utils.AuditExclusions;
import com.itsm.watchtower.audit.utils.RequestUtils;
import com.itsm.watchtower.audit.utils.ResourcePathResolver;
import com.itsm.watchtower.models.audit.AuditActions;
import com.itsm.watchtower.models.audit.ResourceInfo;
import com.itsm.watchtower.spi.AuditSink;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static com.itsm.watchtower.audit.AuditConstants.ACTION_TAG;
import static com.itsm.watchtower.audit.AuditConstants.AUDIT_ERROR_METRIC;
import static com.itsm.watchtower.audit.AuditConstants.EXCEPTION_TAG;

/**
 * Records every mutating API request in the audit trail once its response has been produced.
 * <p>
 * Request facts and the prior state of the resource are captured before the handler runs; the record itself is
 * built and written on the audit writers. Nothing that goes wrong while auditing changes the outcome of the request.
 */
@Slf4j
@RequiredArgsConstructor
public class AuditTrailFilter extends OncePerRequestFilter {

    private static final UrlPathHelper URL_PATH_HELPER = new UrlPathHelper();

    private final PriorStateFetcher priorStateFetcher;
    private final AuditTaskExecutor auditTaskExecutor;
    private final AuditSink auditSink;
    private final RequestUtils requestUtils;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final int maxBodyBytes;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return AuditExclusions.isExcludedPath(URL_PATH_HELPER.getPathWithinApplication(request), request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        HttpServletRequest forwardedRequest = request;
        PendingAudit pendingAudit = null;
        try {
            byte[] body = null;
            if (isCapturable(request)) {
                CachedBodyHttpServletRequest cachedRequest = new CachedBodyHttpServletRequest(request, maxBodyBytes);
                forwardedRequest = cachedRequest;
                body = cachedRequest.getBody();
            }
            pendingAudit = prepare(forwardedRequest, body);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to prepare audit of {} {}, request continues unaudited", request.getMethod(), request.getRequestURI(), e);
            meterRegistry.counter(AUDIT_ERROR_METRIC, ACTION_TAG, "prepare", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
        }

        try {
            filterChain.doFilter(forwardedRequest, response);
        } finally {
            if (pendingAudit != null) {
                complete(forwardedRequest, pendingAudit);
            }
        }
    }

    private PendingAudit prepare(HttpServletRequest request, byte[] body) {
        String path = URL_PATH_HELPER.getPathWithinApplication(request);
        String method = request.getMethod();
        JsonNode parsedBody = parseBody(body);
        ResourceInfo resourceInfo = ResourcePathResolver.extractResourceInfo(path);
        String action = AuditActionClassifier.methodToAction(method);
        AuditRequestContext context = new AuditRequestContext(action, resourceInfo, parsedBody, requestUtils.getActorId(),
                requestUtils.getClientIp(request), requestUtils.getUserAgent(request),
                AuditActionClassifier.isSecurityAction(method, path, parsedBody));

        JsonNode priorState = null;
        if (AuditActions.UPDATE.equals(action) || AuditActions.DELETE.equals(action)) {
            priorState = priorStateFetcher.fetch(resourceInfo).orElse(null);
        }
        log.debug("Auditing {} of {} {}", action, resourceInfo.resourceType(), resourceInfo.resourceId());
        return new PendingAudit(context, priorState, auditTaskExecutor, auditSink);
    }

    private void complete(HttpServletRequest request, PendingAudit pendingAudit) {
        if (request.isAsyncStarted()) {
            request.getAsyncContext().addListener(new AuditCompletionListener(pendingAudit));
        } else {
            pendingAudit.responseSent();
        }
    }

    private boolean isCapturable(HttpServletRequest request) {
        String contentType = request.getContentType();
        if (contentType == null || request.getContentLengthLong() > maxBodyBytes) {
            return false;
        }
        try {
            MediaType mediaType = MediaType.parseMediaType(contentType);
            return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType) || mediaType.getSubtype().endsWith("+json");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private JsonNode parseBody(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() ? null : node;
        } catch (IOException e) {
            log.debug("Request body is not valid JSON, auditing it as text");
            return TextNode.valueOf(new String(body, StandardCharsets.UTF_8));
        }
    }

    @RequiredArgsConstructor
    private static class AuditCompletionListener implements AsyncListener {
        private final PendingAudit pendingAudit;

        @Override
        public void onComplete(AsyncEvent event) {
            pendingAudit.responseSent();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            // onComplete follows
        }

        @Override
        public void onError(AsyncEvent event) {
            // onComplete follows
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
