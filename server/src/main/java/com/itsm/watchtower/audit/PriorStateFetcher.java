package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itsm.watchtower.models.audit.ResourceInfo;
import com.itsm.watchtower.spi.repositories.ResourceStateRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.itsm.watchtower.audit.AuditConstants.EXCEPTION_TAG;
import static com.itsm.watchtower.audit.AuditConstants.PRIOR_STATE_ERROR_METRIC;

/**
 * Loads the stored state of a resource right before it is updated or deleted.
 * <p>
 * Only the resource types in {@link #RESOURCE_TABLES} are looked up. The lookup runs on its own small pool and is
 * abandoned after the configured timeout; any failure means the record is written without a prior state.
 */
@Slf4j
public class PriorStateFetcher {

    static final Map<String, ResourceTable> RESOURCE_TABLES = Map.of(
            "incidents", new ResourceTable("incidents", "ticket_id"),
            "changes", new ResourceTable("changes", "id"),
            "problems", new ResourceTable("problems", "problem_id"),
            "assets", new ResourceTable("assets", "asset_tag"),
            "releases", new ResourceTable("releases", "release_id"),
            "service-requests", new ResourceTable("service_requests", "request_id"),
            "sla", new ResourceTable("sla_agreements", "agreement_id"),
            "vulnerabilities", new ResourceTable("vulnerabilities", "vulnerability_id"),
            "users", new ResourceTable("users", "id")
    );

    private final ResourceStateRepository resourceStateRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Duration timeout;
    private final ThreadPoolExecutor executorService;

    public PriorStateFetcher(ResourceStateRepository resourceStateRepository, ObjectMapper objectMapper, MeterRegistry meterRegistry, Duration timeout, int threads) {
        this.resourceStateRepository = resourceStateRepository;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.timeout = timeout;
        this.executorService = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(threads * 64), new AuditTaskExecutor.AuditThreadFactory("audit-prior-state-"));
        new ExecutorServiceMetrics(executorService, "audit-prior-state", Tags.empty()).bindTo(meterRegistry);
    }

    public Optional<JsonNode> fetch(ResourceInfo resourceInfo) {
        ResourceTable resourceTable = RESOURCE_TABLES.get(resourceInfo.resourceType());
        if (resourceTable == null || !resourceInfo.hasId()) {
            return Optional.empty();
        }
        Future<Optional<Map<String, Object>>> row = null;
        try {
            row = executorService.submit(() -> resourceStateRepository.findRow(resourceTable.table(), resourceTable.idColumn(), resourceInfo.resourceId()));
            return row.get(timeout.toMillis(), TimeUnit.MILLISECONDS).map(this::toJson);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(resourceInfo, e);
        } catch (TimeoutException e) {
            row.cancel(true);
            return failed(resourceInfo, e);
        } catch (ExecutionException e) {
            return failed(resourceInfo, e.getCause() != null ? e.getCause() : e);
        } catch (RejectedExecutionException | IllegalArgumentException e) {
            return failed(resourceInfo, e);
        }
    }

    private JsonNode toJson(Map<String, Object> row) {
        return objectMapper.valueToTree(row);
    }

    private Optional<JsonNode> failed(ResourceInfo resourceInfo, Throwable e) {
        log.warn("Could not load prior state of {} {}: {}", resourceInfo.resourceType(), resourceInfo.resourceId(), e.toString());
        meterRegistry.counter(PRIOR_STATE_ERROR_METRIC, EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
        return Optional.empty();
    }

    @PreDestroy
    public void shutDown() {
        executorService.shutdownNow();
    }

    record ResourceTable(String table, String idColumn) {
    }
}
