package com.itsm.watchtower.spimpl.audit;

import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.spi.AuditSink;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

import static com.itsm.watchtower.audit.AuditConstants.ACTION_TAG;
import static com.itsm.watchtower.audit.AuditConstants.AUDIT_ERROR_METRIC;
import static com.itsm.watchtower.audit.AuditConstants.EXCEPTION_TAG;

/**
 * A simple implementation of {@link AuditSink} which inserts every record into the audit store once.
 * Records that cannot be stored are logged and lost.
 */
@Slf4j
@AllArgsConstructor
public class RepositoryAuditSink implements AuditSink {

    private final AuditRecordRepository auditRecordRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public void write(AuditRecord auditRecord) {
        try {
            AuditRecord stamped = auditRecord.toBuilder().createdAt(Instant.now(clock)).build();
            long id = auditRecordRepository.save(stamped);
            log.debug("Stored audit record {} for {} {}", id, stamped.getAction(), stamped.getResourceType());
        } catch (Exception e) {
            log.error("Failed to store audit record for {} {} {}", auditRecord.getAction(), auditRecord.getResourceType(), auditRecord.getResourceId(), e);
            meterRegistry.counter(AUDIT_ERROR_METRIC, ACTION_TAG, "write", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
        }
    }
}
