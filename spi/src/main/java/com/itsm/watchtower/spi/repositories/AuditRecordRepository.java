package com.itsm.watchtower.spi.repositories;

import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of audit records. There is deliberately no update or delete operation.
 * All methods throw {@link com.itsm.watchtower.spi.AuditStorageException} when the store fails.
 */
public interface AuditRecordRepository {

    /**
     * Inserts the record.
     *
     * @return the generated id
     */
    long save(AuditRecord auditRecord);

    Optional<AuditRecord> findById(long id);

    /**
     * Newest records first.
     */
    List<AuditRecord> find(AuditLogFilter filter, int offset, int limit);

    long count(AuditLogFilter filter);

    /**
     * Aggregates every record created at or after {@code since}.
     */
    AuditStats stats(String period, Instant since);
}
