package com.itsm.watchtower.models.dto.response;

import com.itsm.watchtower.models.db.AuditRecord;

import java.util.List;

public record AuditLogPage(List<AuditRecord> items, long total, int offset, int limit) {
}
