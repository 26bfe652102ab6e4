package com.processflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.repository.AuditEntryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed audit trail. Rows are keyed by (instance_id, sequence_number),
 * so a second writer for the same sequence number fails on the primary key.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "jdbc")
public class JdbcAuditEntryRepository implements AuditEntryRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final AuditEntryRowMapper rowMapper;

    public JdbcAuditEntryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new AuditEntryRowMapper();
    }

    /**
     * Insert one entry. Called by {@link JdbcProcessInstanceRepository} inside its transaction.
     */
    void append(AuditEntry entry) {
        String sql = """
            INSERT INTO audit_entries (
                instance_id, sequence_number, entry_id, timestamp, action, actor,
                details_json, previous_state_json, new_state_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb)
            """;
        jdbcTemplate.update(sql,
            entry.instanceId(),
            entry.sequenceNumber(),
            entry.entryId(),
            JsonColumns.toTimestamp(entry.timestamp()),
            entry.action().tag(),
            entry.actor(),
            json.write(entry.details()),
            json.write(entry.previousState()),
            json.write(entry.newState())
        );
    }

    @Override
    public List<AuditEntry> findByInstance(UUID instanceId) {
        String sql = "SELECT * FROM audit_entries WHERE instance_id = ? ORDER BY sequence_number";
        return jdbcTemplate.query(sql, rowMapper, instanceId);
    }

    @Override
    public List<AuditEntry> findByInstanceUpTo(UUID instanceId, long toSequence) {
        String sql = """
            SELECT * FROM audit_entries
            WHERE instance_id = ? AND sequence_number <= ?
            ORDER BY sequence_number
            """;
        return jdbcTemplate.query(sql, rowMapper, instanceId, toSequence);
    }

    @Override
    public long countByAction(UUID instanceId, LifecycleOperation action) {
        String sql = "SELECT COUNT(*) FROM audit_entries WHERE instance_id = ? AND action = ?";
        Long count = jdbcTemplate.queryForObject(sql, Long.class, instanceId, action.tag());
        return count != null ? count : 0L;
    }

    private class AuditEntryRowMapper implements RowMapper<AuditEntry> {
        @Override
        public AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new AuditEntry(
                    rs.getObject("entry_id", UUID.class),
                    rs.getObject("instance_id", UUID.class),
                    rs.getLong("sequence_number"),
                    JsonColumns.toInstant(rs.getTimestamp("timestamp")),
                    LifecycleOperation.fromTag(rs.getString("action")),
                    rs.getString("actor"),
                    json.readTree(rs.getString("details_json")),
                    json.readTree(rs.getString("previous_state_json")),
                    json.readTree(rs.getString("new_state_json"))
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map audit entry row", e);
            }
        }
    }
}
