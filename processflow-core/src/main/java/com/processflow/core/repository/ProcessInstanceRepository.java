package com.processflow.core.repository;

import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.ProcessInstance;
import com.processflow.core.model.ProcessStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the projected instance state.
 * Every write also appends exactly one audit entry in the same atomic unit.
 */
public interface ProcessInstanceRepository {

    /**
     * Store a new instance together with its first audit entry.
     */
    void create(ProcessInstance instance, AuditEntry firstEntry);

    /**
     * Replace the stored instance and append the entry, provided the stored
     * sequence number is still {@code expectedSequence}. Nothing is written otherwise.
     *
     * @throws com.processflow.core.exception.OptimisticLockException if the sequence moved on
     * @throws com.processflow.core.exception.NotFoundException if the instance does not exist
     */
    void commit(ProcessInstance updated, AuditEntry entry, long expectedSequence);

    Optional<ProcessInstance> findById(UUID instanceId);

    List<ProcessInstance> query(InstanceQuery query);

    /**
     * Number of RUNNING or SUSPENDED instances bound to a definition.
     */
    long countActiveByDefinition(UUID definitionId);

    Map<ProcessStatus, Long> countByStatus();
}
