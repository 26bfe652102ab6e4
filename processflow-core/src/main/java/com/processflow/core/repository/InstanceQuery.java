package com.processflow.core.repository;

import com.processflow.core.model.Priority;
import com.processflow.core.model.ProcessStatus;

import java.util.UUID;

/**
 * Filter for listing process instances. Null fields do not filter.
 * Results are ordered by start time, newest first.
 */
public record InstanceQuery(
    String tenantId,
    ProcessStatus status,
    UUID definitionId,
    String businessKey,
    Priority priority,
    int limit,
    int offset
) {
    public InstanceQuery {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be non-negative");
        }
    }

    public static InstanceQuery forTenant(String tenantId, int limit) {
        return new InstanceQuery(tenantId, null, null, null, null, limit, 0);
    }
}
