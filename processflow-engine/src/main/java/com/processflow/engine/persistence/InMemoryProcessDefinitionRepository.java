package com.processflow.engine.persistence;

import com.processflow.core.exception.DuplicateDefinitionException;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.model.ProcessDefinition;
import com.processflow.core.repository.DefinitionQuery;
import com.processflow.core.repository.ProcessDefinitionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ProcessDefinitionRepository.
 * Writes are serialized so the name and version check and the write happen together.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryProcessDefinitionRepository implements ProcessDefinitionRepository {

    private final Map<UUID, ProcessDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(ProcessDefinition definition) {
        checkKey(definition);
        definitions.put(definition.definitionId(), definition);
    }

    @Override
    public synchronized void update(ProcessDefinition definition) {
        if (!definitions.containsKey(definition.definitionId())) {
            throw new NotFoundException("ProcessDefinition", definition.definitionId().toString());
        }
        checkKey(definition);
        definitions.put(definition.definitionId(), definition);
    }

    @Override
    public Optional<ProcessDefinition> findById(UUID definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    @Override
    public Optional<ProcessDefinition> findByNameAndVersion(String name, String version) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name) && d.version().equals(version))
            .findFirst();
    }

    @Override
    public List<ProcessDefinition> query(DefinitionQuery query) {
        String search = query.search() == null ? null : query.search().toLowerCase(Locale.ROOT);
        return definitions.values().stream()
            .filter(d -> query.tenantId() == null || d.tenantId() == null || query.tenantId().equals(d.tenantId()))
            .filter(d -> query.category() == null || d.category() == query.category())
            .filter(d -> query.active() == null || d.active() == query.active())
            .filter(d -> search == null || matches(d, search))
            .sorted(Comparator.comparing(InMemoryProcessDefinitionRepository::lastTouched).reversed())
            .skip(query.offset())
            .limit(query.limit())
            .toList();
    }

    @Override
    public synchronized boolean delete(UUID definitionId) {
        return definitions.remove(definitionId) != null;
    }

    private void checkKey(ProcessDefinition definition) {
        findByNameAndVersion(definition.name(), definition.version())
            .filter(other -> !other.definitionId().equals(definition.definitionId()))
            .ifPresent(other -> {
                throw new DuplicateDefinitionException(definition.name(), definition.version());
            });
    }

    private static boolean matches(ProcessDefinition definition, String search) {
        return definition.name().toLowerCase(Locale.ROOT).contains(search)
            || (definition.description() != null && definition.description().toLowerCase(Locale.ROOT).contains(search));
    }

    private static Instant lastTouched(ProcessDefinition definition) {
        if (definition.updatedAt() != null) {
            return definition.updatedAt();
        }
        return definition.createdAt() != null ? definition.createdAt() : Instant.EPOCH;
    }
}
