package com.processflow.engine.persistence;

import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.repository.AuditEntryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory audit trail. Entries are appended only by {@link InMemoryProcessInstanceRepository}
 * while it holds the instance's map entry.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditEntryRepository implements AuditEntryRepository {

    private final Map<UUID, List<AuditEntry>> entries = new ConcurrentHashMap<>();

    void append(AuditEntry entry) {
        List<AuditEntry> trail = entries.computeIfAbsent(entry.instanceId(), id -> new ArrayList<>());
        synchronized (trail) {
            long expected = trail.size() + 1L;
            if (entry.sequenceNumber() != expected) {
                throw new IllegalStateException(String.format(
                    "Audit entry %d for instance %s out of order, expected %d",
                    entry.sequenceNumber(), entry.instanceId(), expected));
            }
            trail.add(entry);
        }
    }

    @Override
    public List<AuditEntry> findByInstance(UUID instanceId) {
        List<AuditEntry> trail = entries.get(instanceId);
        if (trail == null) {
            return List.of();
        }
        synchronized (trail) {
            return List.copyOf(trail);
        }
    }

    @Override
    public List<AuditEntry> findByInstanceUpTo(UUID instanceId, long toSequence) {
        return findByInstance(instanceId).stream()
            .filter(e -> e.sequenceNumber() <= toSequence)
            .toList();
    }

    @Override
    public long countByAction(UUID instanceId, LifecycleOperation action) {
        return findByInstance(instanceId).stream()
            .filter(e -> e.action() == action)
            .count();
    }
}
