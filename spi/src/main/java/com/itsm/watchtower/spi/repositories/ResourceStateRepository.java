package com.itsm.watchtower.spi.repositories;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to the rows of the ITSM entity tables, used to snapshot a resource before it is mutated.
 */
public interface ResourceStateRepository {

    /**
     * Loads the row whose {@code idColumn} equals {@code id}.
     *
     * @param table    table name, always taken from a fixed allow list
     * @param idColumn column holding the public id of the resource
     * @param id       id taken from the request path
     * @return column name to value, empty when no row matches
     * @throws com.itsm.watchtower.spi.AuditStorageException when the lookup fails
     */
    Optional<Map<String, Object>> findRow(String table, String idColumn, String id);
}
