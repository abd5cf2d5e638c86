package com.itsm.watchtower.service.interfaces;

import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditLogPage;
import com.itsm.watchtower.models.dto.response.AuditStats;

public interface AuditLogService {

    AuditLogPage listAuditLogs(AuditLogFilter filter, int offset, int limit);

    AuditRecord getAuditLog(long id);

    /**
     * @param period {@code day}, {@code week} or {@code month}; anything else is treated as {@code week}
     */
    AuditStats getStats(String period);
}
