package com.itsm.watchtower.models.dto.response;

import java.util.List;

/**
 * Aggregated view of the audit trail over a period.
 *
 * @param period            {@code day}, {@code week} or {@code month}
 * @param totalLogs         number of records in the period
 * @param securityActions   number of security actions in the period
 * @param actionsByType     record count per action
 * @param actionsByResource ten most audited resource types
 * @param topUsers          ten most active actor ids
 * @param topIps            ten most active client addresses
 * @param activityTimeline  record count per day
 */
public record AuditStats(String period,
                         long totalLogs,
                         long securityActions,
                         List<CountEntry> actionsByType,
                         List<CountEntry> actionsByResource,
                         List<CountEntry> topUsers,
                         List<CountEntry> topIps,
                         List<CountEntry> activityTimeline) {

    public record CountEntry(String key, long count) {
    }
}
