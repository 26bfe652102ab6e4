package com.processflow.core.repository;

import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.LifecycleOperation;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the append-only audit trail.
 * Entries are written by {@link ProcessInstanceRepository} together with the instance row.
 */
public interface AuditEntryRepository {

    /**
     * All entries of an instance ordered by sequence number.
     */
    List<AuditEntry> findByInstance(UUID instanceId);

    /**
     * Entries of an instance up to and including the given sequence number.
     */
    List<AuditEntry> findByInstanceUpTo(UUID instanceId, long toSequence);

    long countByAction(UUID instanceId, LifecycleOperation action);
}
