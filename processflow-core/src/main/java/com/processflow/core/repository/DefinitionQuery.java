package com.processflow.core.repository;

import com.processflow.core.model.ProcessCategory;

/**
 * Filter for listing process definitions. Null fields do not filter;
 * a tenant filter also admits shared definitions, which have no tenant.
 * search matches name or description case-insensitively.
 * Results are ordered by last update, newest first.
 */
public record DefinitionQuery(
    String tenantId,
    ProcessCategory category,
    Boolean active,
    String search,
    int limit,
    int offset
) {
    public DefinitionQuery {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be non-negative");
        }
    }
}
