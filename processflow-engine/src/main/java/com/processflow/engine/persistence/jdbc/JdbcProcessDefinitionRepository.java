package com.processflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processflow.core.exception.DefinitionInUseException;
import com.processflow.core.exception.DuplicateDefinitionException;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.model.ProcessCategory;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.model.ProcessNode;
import com.processflow.core.repository.DefinitionQuery;
import com.processflow.core.repository.ProcessDefinitionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ProcessDefinitionRepository.
 * Nodes, variables, permissions and tags are stored as JSONB.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "jdbc")
public class JdbcProcessDefinitionRepository implements ProcessDefinitionRepository {

    private static final TypeReference<List<ProcessNode>> NODES = new TypeReference<>() {};
    private static final TypeReference<LinkedHashSet<String>> STRING_SET = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumns json;
    private final ProcessDefinitionRowMapper rowMapper;

    public JdbcProcessDefinitionRepository(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new ProcessDefinitionRowMapper();
    }

    @Override
    public void save(ProcessDefinition definition) {
        String sql = """
            INSERT INTO process_definitions (
                definition_id, name, version, description, category,
                nodes_json, variables_json, active, permissions, tags,
                tenant_id, created_by, updated_by, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                definition.definitionId(),
                definition.name(),
                definition.version(),
                definition.description(),
                definition.category().name(),
                json.write(definition.nodes()),
                json.write(definition.variables()),
                definition.active(),
                json.write(definition.permissions()),
                json.write(definition.tags()),
                definition.tenantId(),
                definition.createdBy(),
                definition.updatedBy(),
                JsonColumns.toTimestamp(definition.createdAt()),
                JsonColumns.toTimestamp(definition.updatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateDefinitionException(definition.name(), definition.version());
        }
    }

    @Override
    public void update(ProcessDefinition definition) {
        String sql = """
            UPDATE process_definitions SET
                name = ?,
                version = ?,
                description = ?,
                category = ?,
                nodes_json = ?::jsonb,
                variables_json = ?::jsonb,
                active = ?,
                permissions = ?::jsonb,
                tags = ?::jsonb,
                updated_by = ?,
                updated_at = ?
            WHERE definition_id = ?
            """;
        int rows;
        try {
            rows = jdbcTemplate.update(sql,
                definition.name(),
                definition.version(),
                definition.description(),
                definition.category().name(),
                json.write(definition.nodes()),
                json.write(definition.variables()),
                definition.active(),
                json.write(definition.permissions()),
                json.write(definition.tags()),
                definition.updatedBy(),
                JsonColumns.toTimestamp(definition.updatedAt()),
                definition.definitionId()
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateDefinitionException(definition.name(), definition.version());
        }
        if (rows == 0) {
            throw new NotFoundException("ProcessDefinition", definition.definitionId().toString());
        }
    }

    @Override
    public Optional<ProcessDefinition> findById(UUID definitionId) {
        String sql = "SELECT * FROM process_definitions WHERE definition_id = ?";
        List<ProcessDefinition> results = jdbcTemplate.query(sql, rowMapper, definitionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ProcessDefinition> findByNameAndVersion(String name, String version) {
        String sql = "SELECT * FROM process_definitions WHERE name = ? AND version = ?";
        List<ProcessDefinition> results = jdbcTemplate.query(sql, rowMapper, name, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ProcessDefinition> query(DefinitionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM process_definitions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.tenantId() != null) {
            sql.append(" AND (tenant_id = ? OR tenant_id IS NULL)");
            args.add(query.tenantId());
        }
        if (query.category() != null) {
            sql.append(" AND category = ?");
            args.add(query.category().name());
        }
        if (query.active() != null) {
            sql.append(" AND active = ?");
            args.add(query.active());
        }
        if (query.search() != null && !query.search().isBlank()) {
            sql.append(" AND (LOWER(name) LIKE ? OR LOWER(description) LIKE ?)");
            String pattern = "%" + query.search().toLowerCase(Locale.ROOT) + "%";
            args.add(pattern);
            args.add(pattern);
        }
        sql.append(" ORDER BY COALESCE(updated_at, created_at) DESC LIMIT ? OFFSET ?");
        args.add(query.limit());
        args.add(query.offset());
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    /**
     * Deletes under an exclusive row lock after recounting bound instances, so an instance
     * created by another node between the caller's check and this delete is still seen.
     */
    @Override
    public boolean delete(UUID definitionId) {
        Boolean deleted = transactionTemplate.execute(status -> {
            List<Integer> locked = jdbcTemplate.queryForList(
                "SELECT 1 FROM process_definitions WHERE definition_id = ? FOR UPDATE", Integer.class, definitionId);
            if (locked.isEmpty()) {
                return false;
            }
            Long active = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM process_instances
                WHERE definition_id = ? AND status IN ('RUNNING', 'SUSPENDED')
                """, Long.class, definitionId);
            if (active != null && active > 0) {
                throw new DefinitionInUseException(definitionId, active);
            }
            return jdbcTemplate.update("DELETE FROM process_definitions WHERE definition_id = ?", definitionId) > 0;
        });
        return Boolean.TRUE.equals(deleted);
    }

    private class ProcessDefinitionRowMapper implements RowMapper<ProcessDefinition> {
        @Override
        public ProcessDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new ProcessDefinition(
                    rs.getObject("definition_id", UUID.class),
                    rs.getString("name"),
                    rs.getString("version"),
                    rs.getString("description"),
                    ProcessCategory.valueOf(rs.getString("category")),
                    json.read(rs.getString("nodes_json"), NODES, List.of()),
                    json.readVariables(rs.getString("variables_json")),
                    rs.getBoolean("active"),
                    json.read(rs.getString("permissions"), STRING_SET, new LinkedHashSet<>()),
                    json.read(rs.getString("tags"), STRING_LIST, List.of()),
                    rs.getString("tenant_id"),
                    rs.getString("created_by"),
                    rs.getString("updated_by"),
                    JsonColumns.toInstant(rs.getTimestamp("created_at")),
                    JsonColumns.toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map process definition row", e);
            }
        }
    }
}
