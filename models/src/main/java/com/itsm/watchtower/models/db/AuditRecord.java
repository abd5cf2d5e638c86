package com.itsm.watchtower.models.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.itsm.watchtower.models.audit.AuditDiff;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An entry of the audit trail describing one mutating request.
 * <p>
 * Once stored, a record is never updated or deleted: the repositories only insert and read. Values captured from
 * request bodies and stored rows are always redacted before they reach this object.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AuditRecord {

    /**
     * Identity assigned by the storage on insert. {@code null} until the record has been written.
     */
    private Long id;

    /**
     * Id of the authenticated user who issued the request, {@code null} for anonymous or system requests.
     */
    private Long actorId;

    /**
     * {@code create}, {@code update}, {@code delete} or the lowercased HTTP method.
     */
    private String action;

    /**
     * First path segment after the API prefix, e.g. {@code incidents}.
     */
    private String resourceType;

    /**
     * Second path segment after the API prefix, {@code null} for collection level requests.
     */
    private String resourceId;

    /**
     * Redacted snapshot of the stored row before the mutation. Only present for update and delete requests
     * and never together with {@link #diff}.
     */
    private JsonNode priorState;

    /**
     * Changes between the stored row and the request body. Only present for updates.
     */
    private AuditDiff diff;

    /**
     * Redacted request body.
     */
    private JsonNode newState;

    private String ipAddress;

    private String userAgent;

    private boolean securityAction;

    /**
     * Time at which the record was handed to the storage.
     */
    private Instant createdAt;
}
