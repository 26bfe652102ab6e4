package com.processflow.core.lifecycle;

import com.processflow.core.model.AuditEntry;
import com.processflow.core.model.ProcessInstance;

/**
 * Result of applying one lifecycle operation: the new projected state and
 * the audit entry that records it. Both are committed together or not at all.
 */
public record Transition(ProcessInstance previous, ProcessInstance updated, AuditEntry entry) {

    public static Transition created(ProcessInstance instance, AuditEntry entry) {
        return new Transition(null, instance, entry);
    }

    /**
     * Sequence number the stored instance must still have for this transition to commit.
     */
    public long expectedSequence() {
        return previous == null ? 0 : previous.sequenceNumber();
    }
}
