package com.itsm.watchtower.spi;

import com.itsm.watchtower.models.db.AuditRecord;

/**
 * Final stage of the audit trail: persists a fully built {@link AuditRecord}.
 * <p>
 * The sink is only ever invoked after the client already received its response, so implementations
 * must never throw. A record that cannot be stored is logged and dropped, it is not retried.
 * Possible implementations could be:
 *   - insert into the audit table of a relational database
 *   - append to a file shipped elsewhere
 */
public interface AuditSink {
    void write(AuditRecord auditRecord);
}
