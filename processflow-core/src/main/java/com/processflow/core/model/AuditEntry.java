package com.processflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one state-changing operation applied to a process instance.
 * Append-only log for history and replay.
 *
 * Primary Key: (instanceId, sequenceNumber)
 *
 * Invariants:
 * - sequenceNumber is contiguous within an instance, starting at 1
 * - entries are never modified or deleted
 * - timestamps are non-decreasing within an instance
 */
public record AuditEntry(
    UUID entryId,
    UUID instanceId,
    long sequenceNumber,
    Instant timestamp,
    LifecycleOperation action,
    String actor,
    JsonNode details,
    JsonNode previousState,
    JsonNode newState
) {
    public static AuditEntry create(
            UUID instanceId,
            long sequenceNumber,
            Instant timestamp,
            LifecycleOperation action,
            String actor,
            JsonNode details,
            JsonNode previousState,
            JsonNode newState) {
        return new AuditEntry(
            UUID.randomUUID(),
            instanceId,
            sequenceNumber,
            timestamp,
            action,
            actor,
            details,
            previousState,
            newState
        );
    }

    /**
     * Read a text field from the details payload.
     */
    public String detail(String field) {
        if (details == null || !details.hasNonNull(field)) {
            return null;
        }
        return details.get(field).asText();
    }
}
