package com.itsm.watchtower.audit;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.itsm.watchtower.audit.AuditConstants.ACTION_TAG;
import static com.itsm.watchtower.audit.AuditConstants.AUDIT_DROPPED_METRIC;
import static com.itsm.watchtower.audit.AuditConstants.AUDIT_ERROR_METRIC;
import static com.itsm.watchtower.audit.AuditConstants.EXCEPTION_TAG;

/**
 * Runs audit tasks off the request thread on a fixed number of workers with a bounded queue.
 * <p>
 * Tasks that do not fit in the queue are dropped, so a slow audit store can never hold up or fail a request.
 */
@Slf4j
public class AuditTaskExecutor {

    private final ThreadPoolExecutor executorService;
    private final MeterRegistry meterRegistry;
    private final Duration shutdownTimeout;

    public AuditTaskExecutor(int threads, int queueSize, Duration shutdownTimeout, MeterRegistry meterRegistry) {
        this.executorService = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueSize), new AuditThreadFactory("audit-writer-"), new ThreadPoolExecutor.AbortPolicy());
        this.meterRegistry = meterRegistry;
        this.shutdownTimeout = shutdownTimeout;
        new ExecutorServiceMetrics(executorService, "audit-writer", Tags.empty()).bindTo(meterRegistry);
    }

    /**
     * @return {@code false} when the task was dropped
     */
    public boolean submit(Runnable task) {
        try {
            executorService.execute(() -> runGuarded(task));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Audit queue is full or shut down, dropping audit record");
            meterRegistry.counter(AUDIT_DROPPED_METRIC).increment();
            return false;
        }
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Audit task failed", e);
            meterRegistry.counter(AUDIT_ERROR_METRIC, ACTION_TAG, "task", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
        }
    }

    @PreDestroy
    public void shutDown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Audit writers did not finish within {}, {} records discarded", shutdownTimeout, executorService.getQueue().size());
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    static class AuditThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        AuditThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
