package com.processflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Types of steps that can appear in a process definition.
 * Only START and END carry engine semantics; the rest are advanced by
 * an external caller completing the step.
 */
public enum NodeType {
    START,
    TASK,

    /**
     * Human approval. Advanced like a task: the first outgoing connection wins.
     */
    APPROVAL,

    /**
     * Call to an external service, triggered and completed by a collaborator.
     */
    SERVICE,

    /**
     * Branching point. No condition evaluation happens; the first outgoing connection wins.
     */
    GATEWAY,

    TIMER,
    EMAIL,
    END;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
