package com.itsm.watchtower.service.impl;

import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditLogPage;
import com.itsm.watchtower.models.dto.response.AuditStats;
import com.itsm.watchtower.service.interfaces.AuditLogService;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AuditLogServiceImpl implements AuditLogService {

    static final String DEFAULT_PERIOD = "week";
    static final int MAX_LIMIT = 100;

    private static final Map<String, Duration> PERIODS = Map.of(
            "day", Duration.ofDays(1),
            DEFAULT_PERIOD, Duration.ofDays(7),
            "month", Duration.ofDays(30)
    );

    private final AuditRecordRepository auditRecordRepository;

    @Override
    public AuditLogPage listAuditLogs(AuditLogFilter filter, int offset, int limit) {
        if (offset < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_LIMIT);
        }
        if (filter.fromDate() != null && filter.toDate() != null && filter.fromDate().isAfter(filter.toDate())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "fromDate must not be after toDate");
        }
        List<AuditRecord> items = auditRecordRepository.find(filter, offset, limit);
        long total = auditRecordRepository.count(filter);
        return new AuditLogPage(items, total, offset, limit);
    }

    @Override
    public AuditRecord getAuditLog(long id) {
        return auditRecordRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Audit log not found: " + id));
    }

    @Override
    public AuditStats getStats(String period) {
        String effectivePeriod = period != null && PERIODS.containsKey(period) ? period : DEFAULT_PERIOD;
        Instant since = Instant.now().minus(PERIODS.get(effectivePeriod));
        return auditRecordRepository.stats(effectivePeriod, since);
    }
}
