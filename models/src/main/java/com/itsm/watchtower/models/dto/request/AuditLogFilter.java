package com.itsm.watchtower.models.dto.request;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Criteria for browsing the audit trail. Every field is optional, {@code null} means no restriction.
 *
 * @param userId       exact actor id
 * @param action       exact action name
 * @param resourceType substring of the resource type
 * @param resourceId   exact resource id
 * @param securityOnly only security actions when {@code true}
 * @param fromDate     first day, inclusive
 * @param toDate       last day, inclusive
 * @param ipAddress    substring of the client address
 */
@Builder
public record AuditLogFilter(Long userId,
                             String action,
                             String resourceType,
                             String resourceId,
                             boolean securityOnly,
                             LocalDate fromDate,
                             LocalDate toDate,
                             String ipAddress) {

    public static AuditLogFilter none() {
        return AuditLogFilter.builder().build();
    }
}
