package com.processflow.engine.persistence;

import com.processflow.core.exception.NotFoundException;
import com.processflow.core.exception.OptimisticLockException;
import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.repository.InstanceQuery;
import com.processflow.core.repository.ProcessInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ProcessInstanceRepository.
 * The conditional commit runs inside {@link ConcurrentHashMap#compute}, which holds the
 * instance's entry for the duration of the sequence check, the audit append and the replace.
 */
@Repository
@ConditionalOnProperty(prefix = "processflow.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryProcessInstanceRepository implements ProcessInstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProcessInstanceRepository.class);

    private final Map<UUID, ProcessInstance> instances = new ConcurrentHashMap<>();
    private final InMemoryAuditEntryRepository auditRepository;

    public InMemoryProcessInstanceRepository(InMemoryAuditEntryRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    @Override
    public void create(ProcessInstance instance, AuditEntry firstEntry) {
        instances.compute(instance.instanceId(), (id, stored) -> {
            if (stored != null) {
                throw new IllegalStateException("Process instance already exists: " + id);
            }
            auditRepository.append(firstEntry);
            return instance;
        });
        log.debug("Created instance {} with sequence {}", instance.instanceId(), instance.sequenceNumber());
    }

    @Override
    public void commit(ProcessInstance updated, AuditEntry entry, long expectedSequence) {
        instances.compute(updated.instanceId(), (id, stored) -> {
            if (stored == null) {
                throw new NotFoundException("ProcessInstance", id.toString());
            }
            if (stored.sequenceNumber() != expectedSequence) {
                throw new OptimisticLockException(id, expectedSequence, stored.sequenceNumber());
            }
            auditRepository.append(entry);
            return updated;
        });
        log.debug("Committed instance {} at sequence {}", updated.instanceId(), updated.sequenceNumber());
    }

    @Override
    public Optional<ProcessInstance> findById(UUID instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<ProcessInstance> query(InstanceQuery query) {
        return instances.values().stream()
            .filter(i -> query.tenantId() == null || query.tenantId().equals(i.tenantId()))
            .filter(i -> query.status() == null || i.status() == query.status())
            .filter(i -> query.definitionId() == null || query.definitionId().equals(i.definitionId()))
            .filter(i -> query.businessKey() == null || query.businessKey().equals(i.businessKey()))
            .filter(i -> query.priority() == null || i.priority() == query.priority())
            .sorted(Comparator.comparing(ProcessInstance::startTime).reversed())
            .skip(query.offset())
            .limit(query.limit())
            .toList();
    }

    @Override
    public long countActiveByDefinition(UUID definitionId) {
        return instances.values().stream()
            .filter(i -> definitionId.equals(i.definitionId()))
            .filter(i -> i.status().isActive())
            .count();
    }

    @Override
    public Map<ProcessStatus, Long> countByStatus() {
        Map<ProcessStatus, Long> counts = new EnumMap<>(ProcessStatus.class);
        for (ProcessInstance instance : instances.values()) {
            counts.merge(instance.status(), 1L, Long::sum);
        }
        return counts;
    }
}
