package com.processflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states for a process instance.
 * Transitions follow a strict state machine - see {@link LifecycleOperation}.
 */
public enum ProcessStatus {
    /**
     * Active execution, tasks may be completed.
     */
    RUNNING,

    /**
     * Execution halted until resumed.
     */
    SUSPENDED,

    /**
     * Cancelled by a caller. Terminal state.
     */
    CANCELLED,

    /**
     * Reached an end node or a step without outgoing connections. Terminal state.
     */
    COMPLETED,

    /**
     * Failure signalled by an external collaborator. Terminal state, left only by retry.
     */
    FAILED;

    /**
     * Check if this status is terminal. Exactly the terminal statuses carry an end time.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    /**
     * Check if this status blocks deletion of the bound definition.
     */
    public boolean isActive() {
        return this == RUNNING || this == SUSPENDED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProcessStatus fromValue(String value) {
        return ProcessStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
