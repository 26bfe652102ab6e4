package com.processflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * State-changing operations on a process instance.
 * The tag is the action recorded in the audit trail.
 */
public enum LifecycleOperation {
    START("process_started", EnumSet.noneOf(ProcessStatus.class)),
    COMPLETE_TASK("task_completed", EnumSet.of(ProcessStatus.RUNNING)),
    SUSPEND("suspend", EnumSet.of(ProcessStatus.RUNNING)),
    RESUME("resume", EnumSet.of(ProcessStatus.SUSPENDED)),
    CANCEL("cancel", EnumSet.of(ProcessStatus.RUNNING, ProcessStatus.SUSPENDED)),
    FAIL("fail", EnumSet.of(ProcessStatus.RUNNING)),
    RETRY("retry", EnumSet.of(ProcessStatus.FAILED)),
    UPDATE_VARIABLES("update_variables", EnumSet.of(ProcessStatus.RUNNING, ProcessStatus.SUSPENDED));

    private final String tag;
    private final Set<ProcessStatus> validFrom;

    LifecycleOperation(String tag, Set<ProcessStatus> validFrom) {
        this.tag = tag;
        this.validFrom = validFrom;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Statuses from which this operation may be applied. Empty for START,
     * which creates the instance.
     */
    public Set<ProcessStatus> validFrom() {
        return Set.copyOf(validFrom);
    }

    public boolean isAllowedFrom(ProcessStatus status) {
        return validFrom.contains(status);
    }

    @JsonCreator
    public static LifecycleOperation fromTag(String tag) {
        for (LifecycleOperation operation : values()) {
            if (operation.tag.equals(tag)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + tag);
    }
}
