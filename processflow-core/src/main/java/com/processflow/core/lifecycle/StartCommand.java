package com.processflow.core.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.processflow.core.model.Priority;

import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied parameters for starting an instance.
 * businessKey and priority are resolved to defaults before the state machine sees them.
 */
public record StartCommand(
    String businessKey,
    String tenantId,
    String departmentId,
    String initiatedBy,
    Map<String, JsonNode> variables,
    Priority priority,
    Set<String> assignedTo
) {
    public StartCommand {
        variables = variables == null ? Map.of() : variables;
        assignedTo = assignedTo == null ? Set.of() : Set.copyOf(assignedTo);
    }
}
