package com.processflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.exception.OptimisticLockException;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.InstanceQuery;
import com.processflow.core.repository.ProcessInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ProcessInstanceRepository.
 * The instance row update and the audit insert share one transaction; the update is
 * conditional on the sequence number the caller read.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "jdbc")
public class JdbcProcessInstanceRepository implements ProcessInstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcProcessInstanceRepository.class);

    private static final TypeReference<LinkedHashSet<String>> STRING_SET = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcAuditEntryRepository auditRepository;
    private final JsonColumns json;
    private final ProcessInstanceRowMapper rowMapper;

    public JdbcProcessInstanceRepository(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            JdbcAuditEntryRepository auditRepository,
            ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.auditRepository = auditRepository;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new ProcessInstanceRowMapper();
    }

    @Override
    public void create(ProcessInstance instance, AuditEntry firstEntry) {
        String sql = """
            INSERT INTO process_instances (
                instance_id, definition_id, definition_name, definition_version,
                business_key, tenant_id, department_id, status, current_step,
                variables_json, start_time, end_time, initiated_by, assigned_to,
                priority, sequence_number, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?::jsonb, ?, ?, ?)
            """;

        transactionTemplate.executeWithoutResult(status -> {
            lockDefinition(instance);
            jdbcTemplate.update(sql,
                instance.instanceId(),
                instance.definitionId(),
                instance.definitionName(),
                instance.definitionVersion(),
                instance.businessKey(),
                instance.tenantId(),
                instance.departmentId(),
                instance.status().name(),
                instance.currentStep(),
                json.write(instance.variables()),
                JsonColumns.toTimestamp(instance.startTime()),
                JsonColumns.toTimestamp(instance.endTime()),
                instance.initiatedBy(),
                json.write(instance.assignedTo()),
                instance.priority().name(),
                instance.sequenceNumber(),
                JsonColumns.toTimestamp(instance.updatedAt())
            );
            auditRepository.append(firstEntry);
        });
        log.debug("Created instance {} with sequence {}", instance.instanceId(), instance.sequenceNumber());
    }

    // Shared row lock: a concurrent definition delete waits for this transaction, or wins and we see no row.
    private void lockDefinition(ProcessInstance instance) {
        List<Integer> bound = jdbcTemplate.queryForList(
            "SELECT 1 FROM process_definitions WHERE definition_id = ? FOR SHARE",
            Integer.class, instance.definitionId());
        if (bound.isEmpty()) {
            throw new NotFoundException("ProcessDefinition", instance.definitionId().toString());
        }
    }

    @Override
    public void commit(ProcessInstance updated, AuditEntry entry, long expectedSequence) {
        String sql = """
            UPDATE process_instances SET
                status = ?,
                current_step = ?,
                variables_json = ?::jsonb,
                end_time = ?,
                assigned_to = ?::jsonb,
                priority = ?,
                sequence_number = ?,
                updated_at = ?
            WHERE instance_id = ? AND sequence_number = ?
            """;

        try {
            transactionTemplate.executeWithoutResult(status -> {
                int rows = jdbcTemplate.update(sql,
                    updated.status().name(),
                    updated.currentStep(),
                    json.write(updated.variables()),
                    JsonColumns.toTimestamp(updated.endTime()),
                    json.write(updated.assignedTo()),
                    updated.priority().name(),
                    updated.sequenceNumber(),
                    JsonColumns.toTimestamp(updated.updatedAt()),
                    updated.instanceId(),
                    expectedSequence
                );
                if (rows == 0) {
                    throw conflictOrMissing(updated.instanceId(), expectedSequence);
                }
                auditRepository.append(entry);
            });
        } catch (DuplicateKeyException e) {
            throw new OptimisticLockException(updated.instanceId(), expectedSequence);
        }
        log.debug("Committed instance {} at sequence {}", updated.instanceId(), updated.sequenceNumber());
    }

    private RuntimeException conflictOrMissing(UUID instanceId, long expectedSequence) {
        List<Long> current = jdbcTemplate.queryForList(
            "SELECT sequence_number FROM process_instances WHERE instance_id = ?", Long.class, instanceId);
        if (current.isEmpty()) {
            return new NotFoundException("ProcessInstance", instanceId.toString());
        }
        return new OptimisticLockException(instanceId, expectedSequence, current.get(0));
    }

    @Override
    public Optional<ProcessInstance> findById(UUID instanceId) {
        String sql = "SELECT * FROM process_instances WHERE instance_id = ?";
        List<ProcessInstance> results = jdbcTemplate.query(sql, rowMapper, instanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ProcessInstance> query(InstanceQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM process_instances WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.tenantId() != null) {
            sql.append(" AND tenant_id = ?");
            args.add(query.tenantId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            args.add(query.status().name());
        }
        if (query.definitionId() != null) {
            sql.append(" AND definition_id = ?");
            args.add(query.definitionId());
        }
        if (query.businessKey() != null) {
            sql.append(" AND business_key = ?");
            args.add(query.businessKey());
        }
        if (query.priority() != null) {
            sql.append(" AND priority = ?");
            args.add(query.priority().name());
        }
        sql.append(" ORDER BY start_time DESC LIMIT ? OFFSET ?");
        args.add(query.limit());
        args.add(query.offset());
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    public long countActiveByDefinition(UUID definitionId) {
        String sql = """
            SELECT COUNT(*) FROM process_instances
            WHERE definition_id = ? AND status IN ('RUNNING', 'SUSPENDED')
            """;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, definitionId);
        return count != null ? count : 0L;
    }

    @Override
    public Map<ProcessStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS count FROM process_instances GROUP BY status";
        Map<ProcessStatus, Long> counts = new EnumMap<>(ProcessStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(ProcessStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    private class ProcessInstanceRowMapper implements RowMapper<ProcessInstance> {
        @Override
        public ProcessInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                Set<String> assignedTo = json.read(rs.getString("assigned_to"), STRING_SET, new LinkedHashSet<>());
                return new ProcessInstance(
                    rs.getObject("instance_id", UUID.class),
                    rs.getObject("definition_id", UUID.class),
                    rs.getString("definition_name"),
                    rs.getString("definition_version"),
                    rs.getString("business_key"),
                    rs.getString("tenant_id"),
                    rs.getString("department_id"),
                    ProcessStatus.valueOf(rs.getString("status")),
                    rs.getString("current_step"),
                    json.readVariables(rs.getString("variables_json")),
                    JsonColumns.toInstant(rs.getTimestamp("start_time")),
                    JsonColumns.toInstant(rs.getTimestamp("end_time")),
                    rs.getString("initiated_by"),
                    assignedTo,
                    Priority.valueOf(rs.getString("priority")),
                    rs.getLong("sequence_number"),
                    JsonColumns.toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map process instance row", e);
            }
        }
    }
}
