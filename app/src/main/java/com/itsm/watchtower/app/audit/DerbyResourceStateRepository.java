package com.itsm.watchtower.app.audit;

import com.itsm.watchtower.spi.AuditStorageException;
import com.itsm.watchtower.spi.repositories.ResourceStateRepository;
import lombok.AllArgsConstructor;

import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

@AllArgsConstructor
public class DerbyResourceStateRepository implements ResourceStateRepository {

    private final DerbyDao derbyDao;

    @Override
    public Optional<Map<String, Object>> findRow(String table, String idColumn, String id) {
        try {
            return derbyDao.findRow(table, idColumn, id);
        } catch (SQLException e) {
            throw new AuditStorageException("Failed to read " + table + " row " + id, e);
        }
    }
}
