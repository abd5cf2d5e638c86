package com.itsm.watchtower.app.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itsm.watchtower.models.audit.AuditDiff;
import com.itsm.watchtower.models.db.AuditRecord;
import com.itsm.watchtower.models.dto.request.AuditLogFilter;
import com.itsm.watchtower.models.dto.response.AuditStats;
import io.micrometer.core.annotation.Timed;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Plain JDBC access to the derby database: the {@code audit_logs} table and read only lookups of ITSM rows.
 */
@Timed
@Slf4j
@AllArgsConstructor
public class DerbyDao {
    private static final String ALREADY_EXISTS = "X0Y32";
    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int TOP_ENTRIES = 10;

    static final int ACTION_LENGTH = 50;
    static final int RESOURCE_TYPE_LENGTH = 100;
    static final int RESOURCE_ID_LENGTH = 100;
    static final int IP_ADDRESS_LENGTH = 45;
    static final int USER_AGENT_LENGTH = 500;

    private static final String COLUMNS = "id, user_id, action, resource_type, resource_id, old_values, diff, new_values, ip_address, user_agent, is_security_action, created_at";

    private final String derbyUrl;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void init() throws SQLException {
        executeIgnoringExisting("CREATE TABLE audit_logs (" +
                "id BIGINT PRIMARY KEY GENERATED ALWAYS AS IDENTITY (START WITH 1, INCREMENT BY 1), " +
                "user_id BIGINT, " +
                "action VARCHAR(" + ACTION_LENGTH + ") NOT NULL, " +
                "resource_type VARCHAR(" + RESOURCE_TYPE_LENGTH + ") NOT NULL, " +
                "resource_id VARCHAR(" + RESOURCE_ID_LENGTH + "), " +
                "old_values CLOB, " +
                "diff CLOB, " +
                "new_values CLOB, " +
                "ip_address VARCHAR(" + IP_ADDRESS_LENGTH + "), " +
                "user_agent VARCHAR(" + USER_AGENT_LENGTH + "), " +
                "is_security_action BOOLEAN DEFAULT FALSE, " +
                "created_at TIMESTAMP NOT NULL)");
        executeIgnoringExisting("CREATE INDEX idx_audit_logs_user ON audit_logs (user_id)");
        executeIgnoringExisting("CREATE INDEX idx_audit_logs_resource ON audit_logs (resource_type, resource_id)");
        executeIgnoringExisting("CREATE INDEX idx_audit_logs_created ON audit_logs (created_at)");
        executeIgnoringExisting("CREATE INDEX idx_audit_logs_security ON audit_logs (is_security_action)");
    }

    private void executeIgnoringExisting(String ddl) throws SQLException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            if (!ALREADY_EXISTS.equals(e.getSQLState())) {
                throw e;
            }
        }
    }

    public long insertAuditRecord(AuditRecord auditRecord) throws SQLException, JsonProcessingException {
        String sql = "INSERT INTO audit_logs (user_id, action, resource_type, resource_id, old_values, diff, new_values, " +
                "ip_address, user_agent, is_security_action, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            if (auditRecord.getActorId() == null) {
                statement.setNull(1, Types.BIGINT);
            } else {
                statement.setLong(1, auditRecord.getActorId());
            }
            statement.setString(2, truncate(auditRecord.getAction(), ACTION_LENGTH));
            statement.setString(3, truncate(auditRecord.getResourceType(), RESOURCE_TYPE_LENGTH));
            statement.setString(4, truncate(auditRecord.getResourceId(), RESOURCE_ID_LENGTH));
            setJson(statement, 5, auditRecord.getPriorState());
            setJson(statement, 6, auditRecord.getDiff());
            setJson(statement, 7, auditRecord.getNewState());
            statement.setString(8, truncate(auditRecord.getIpAddress(), IP_ADDRESS_LENGTH));
            statement.setString(9, truncate(auditRecord.getUserAgent(), USER_AGENT_LENGTH));
            statement.setBoolean(10, auditRecord.isSecurityAction());
            statement.setTimestamp(11, Timestamp.from(auditRecord.getCreatedAt()));
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for audit record");
                }
                return keys.getLong(1);
            }
        }
    }

    public Optional<AuditRecord> findAuditRecord(long id) throws SQLException, JsonProcessingException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement("SELECT " + COLUMNS + " FROM audit_logs WHERE id = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(toAuditRecord(resultSet)) : Optional.empty();
            }
        }
    }

    public List<AuditRecord> findAuditRecords(AuditLogFilter filter, int offset, int limit) throws SQLException, JsonProcessingException {
        WhereClause where = WhereClause.of(filter);
        String sql = "SELECT " + COLUMNS + " FROM audit_logs" + where.sql() +
                " ORDER BY created_at DESC, id DESC OFFSET ? ROWS FETCH NEXT ? ROWS ONLY";
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = where.bind(statement);
            statement.setInt(index++, offset);
            statement.setInt(index, limit);
            List<AuditRecord> auditRecords = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    auditRecords.add(toAuditRecord(resultSet));
                }
            }
            return auditRecords;
        }
    }

    public long countAuditRecords(AuditLogFilter filter) throws SQLException {
        WhereClause where = WhereClause.of(filter);
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM audit_logs" + where.sql())) {
            where.bind(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getLong(1);
            }
        }
    }

    public AuditStats stats(String period, Instant since) throws SQLException {
        Timestamp from = Timestamp.from(since);
        try (Connection connection = DriverManager.getConnection(derbyUrl)) {
            long total = count(connection, "SELECT COUNT(*) FROM audit_logs WHERE created_at >= ?", from);
            long security = count(connection, "SELECT COUNT(*) FROM audit_logs WHERE created_at >= ? AND is_security_action = TRUE", from);
            List<AuditStats.CountEntry> byType = countEntries(connection,
                    "SELECT action, COUNT(*) FROM audit_logs WHERE created_at >= ? GROUP BY action ORDER BY 2 DESC, 1", from);
            List<AuditStats.CountEntry> byResource = countEntries(connection,
                    "SELECT resource_type, COUNT(*) FROM audit_logs WHERE created_at >= ? GROUP BY resource_type ORDER BY 2 DESC, 1 FETCH FIRST " + TOP_ENTRIES + " ROWS ONLY", from);
            List<AuditStats.CountEntry> topUsers = countEntries(connection,
                    "SELECT user_id, COUNT(*) FROM audit_logs WHERE created_at >= ? AND user_id IS NOT NULL GROUP BY user_id ORDER BY 2 DESC, 1 FETCH FIRST " + TOP_ENTRIES + " ROWS ONLY", from);
            List<AuditStats.CountEntry> topIps = countEntries(connection,
                    "SELECT ip_address, COUNT(*) FROM audit_logs WHERE created_at >= ? AND ip_address IS NOT NULL GROUP BY ip_address ORDER BY 2 DESC, 1 FETCH FIRST " + TOP_ENTRIES + " ROWS ONLY", from);
            List<AuditStats.CountEntry> timeline = countEntries(connection,
                    "SELECT d, COUNT(*) FROM (SELECT DATE(created_at) AS d FROM audit_logs WHERE created_at >= ?) AS t GROUP BY d ORDER BY d", from);
            return new AuditStats(period, total, security, byType, byResource, topUsers, topIps, timeline);
        }
    }

    /**
     * Reads one row of an ITSM table. Column names are returned in lowercase.
     */
    public Optional<Map<String, Object>> findRow(String table, String idColumn, String id) throws SQLException {
        if (!SQL_IDENTIFIER.matcher(table).matches() || !SQL_IDENTIFIER.matcher(idColumn).matches()) {
            throw new IllegalArgumentException("Invalid table or column name: " + table + "." + idColumn);
        }
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement("SELECT * FROM " + table + " WHERE " + idColumn + " = ?")) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                ResultSetMetaData metaData = resultSet.getMetaData();
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= metaData.getColumnCount(); i++) {
                    row.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), toPlainValue(resultSet.getObject(i)));
                }
                return Optional.of(row);
            }
        }
    }

    private static Object toPlainValue(Object value) throws SQLException {
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        return value;
    }

    private static long count(Connection connection, String sql, Timestamp from) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setTimestamp(1, from);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getLong(1);
            }
        }
    }

    private static List<AuditStats.CountEntry> countEntries(Connection connection, String sql, Timestamp from) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setTimestamp(1, from);
            List<AuditStats.CountEntry> entries = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    entries.add(new AuditStats.CountEntry(resultSet.getString(1), resultSet.getLong(2)));
                }
            }
            return entries;
        }
    }

    private void setJson(PreparedStatement statement, int index, Object value) throws SQLException, JsonProcessingException {
        if (value == null) {
            statement.setNull(index, Types.CLOB);
        } else {
            statement.setString(index, objectMapper.writeValueAsString(value));
        }
    }

    private AuditRecord toAuditRecord(ResultSet resultSet) throws SQLException, JsonProcessingException {
        long userId = resultSet.getLong("user_id");
        Long actorId = resultSet.wasNull() ? null : userId;
        String diff = resultSet.getString("diff");
        return AuditRecord.builder()
                .id(resultSet.getLong("id"))
                .actorId(actorId)
                .action(resultSet.getString("action"))
                .resourceType(resultSet.getString("resource_type"))
                .resourceId(resultSet.getString("resource_id"))
                .priorState(readJson(resultSet.getString("old_values")))
                .diff(diff == null ? null : objectMapper.readValue(diff, AuditDiff.class))
                .newState(readJson(resultSet.getString("new_values")))
                .ipAddress(resultSet.getString("ip_address"))
                .userAgent(resultSet.getString("user_agent"))
                .securityAction(resultSet.getBoolean("is_security_action"))
                .createdAt(resultSet.getTimestamp("created_at").toInstant())
                .build();
    }

    private JsonNode readJson(String json) throws JsonProcessingException {
        return json == null ? null : objectMapper.readTree(json);
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private record WhereClause(String sql, List<Object> params) {

        static WhereClause of(AuditLogFilter filter) {
            List<String> conditions = new ArrayList<>();
            List<Object> params = new ArrayList<>();
            if (filter.userId() != null) {
                conditions.add("user_id = ?");
                params.add(filter.userId());
            }
            if (filter.action() != null) {
                conditions.add("action = ?");
                params.add(filter.action());
            }
            if (filter.resourceType() != null) {
                conditions.add("resource_type LIKE ?");
                params.add("%" + filter.resourceType() + "%");
            }
            if (filter.resourceId() != null) {
                conditions.add("resource_id = ?");
                params.add(filter.resourceId());
            }
            if (filter.securityOnly()) {
                conditions.add("is_security_action = TRUE");
            }
            if (filter.fromDate() != null) {
                conditions.add("created_at >= ?");
                params.add(Timestamp.valueOf(filter.fromDate().atStartOfDay()));
            }
            if (filter.toDate() != null) {
                // inclusive through the end of the last day
                conditions.add("created_at < ?");
                params.add(Timestamp.valueOf(filter.toDate().plusDays(1).atStartOfDay()));
            }
            if (filter.ipAddress() != null) {
                conditions.add("ip_address LIKE ?");
                params.add("%" + filter.ipAddress() + "%");
            }
            return new WhereClause(conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions), params);
        }

        /**
         * @return index of the next free parameter
         */
        int bind(PreparedStatement statement) throws SQLException {
            int index = 1;
            for (Object param : params) {
                statement.setObject(index++, param);
            }
            return index;
        }
    }
}
