package com.itsm.watchtower.app.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditStats;
import com.itsm.watchtower.spi.AuditStorageException;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import lombok.AllArgsConstructor;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@AllArgsConstructor
public class DerbyAuditRecordRepository implements AuditRecordRepository {

    private final DerbyDao derbyDao;

    @Override
    public long save(AuditRecord auditRecord) {
        try {
            return derbyDao.insertAuditRecord(auditRecord);
        } catch (SQLException | JsonProcessingException e) {
            throw new AuditStorageException("Failed to insert audit record", e);
        }
    }

    @Override
    public Optional<AuditRecord> findById(long id) {
        try {
            return derbyDao.findAuditRecord(id);
        } catch (SQLException | JsonProcessingException e) {
            throw new AuditStorageException("Failed to read audit record " + id, e);
        }
    }

    @Override
    public List<AuditRecord> find(AuditLogFilter filter, int offset, int limit) {
        try {
            return derbyDao.findAuditRecords(filter, offset, limit);
        } catch (SQLException | JsonProcessingException e) {
            throw new AuditStorageException("Failed to query audit records", e);
        }
    }

    @Override
    public long count(AuditLogFilter filter) {
        try {
            return derbyDao.countAuditRecords(filter);
        } catch (SQLException e) {
            throw new AuditStorageException("Failed to count audit records", e);
        }
    }

    @Override
    public AuditStats stats(String period, Instant since) {
        try {
            return derbyDao.stats(period, since);
        } catch (SQLException e) {
            throw new AuditStorageException("Failed to compute audit statistics", e);
        }
    }
}
