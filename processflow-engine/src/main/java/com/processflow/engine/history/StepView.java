package com.processflow.engine.history;

import com.processflow.core.model.NodeType;

/**
 * Progress of one definition node within an instance.
 */
public record StepView(
    String nodeId,
    String name,
    NodeType type,
    StepStatus status,
    String assignee,
    String completedAt,
    String completedBy
) {}
