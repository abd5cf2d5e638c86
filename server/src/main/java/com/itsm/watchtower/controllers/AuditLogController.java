package com.itsm.watchtower.controllers;

import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditLogPage;
import com.itsm.watchtower.models.dto.response.AuditStats;
import com.itsm.watchtower.models.dto.response.ResponseTemplate;
import com.itsm.watchtower.service.interfaces.AuditLogService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/audit-logs")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
public class AuditLogController {

    private final AuditLogService auditLogService;

    @Operation(summary = "Lists audit records, newest first, filtered by the given criteria.")
    @GetMapping
    public ResponseTemplate<AuditLogPage> listAuditLogs(
            @RequestParam(name = "userId", required = false) Long userId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "resourceType", required = false) String resourceType,
            @RequestParam(name = "resourceId", required = false) String resourceId,
            @RequestParam(name = "securityOnly", defaultValue = "false") boolean securityOnly,
            @RequestParam(name = "fromDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "toDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "ipAddress", required = false) String ipAddress,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        AuditLogFilter filter = AuditLogFilter.builder()
                .userId(userId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .securityOnly(securityOnly)
                .fromDate(fromDate)
                .toDate(toDate)
                .ipAddress(ipAddress)
                .build();
        return ResponseTemplate.success(auditLogService.listAuditLogs(filter, offset, limit), "Successfully listed audit logs.");
    }

    @Operation(summary = "Aggregates the audit trail over the last day, week or month.")
    @GetMapping("/stats")
    public ResponseTemplate<AuditStats> getStats(@RequestParam(name = "period", defaultValue = "week") String period) {
        return ResponseTemplate.success(auditLogService.getStats(period), "Successfully computed audit statistics.");
    }

    @Operation(summary = "Reads a single audit record.")
    @GetMapping("/{id}")
    public ResponseTemplate<AuditRecord> getAuditLog(@PathVariable("id") long id) {
        return ResponseTemplate.success(auditLogService.getAuditLog(id), "Successfully read audit log.");
    }
}
