package com.processflow.core.exception;

import com.processflow.core.model.LifecycleOperation;
import com.processflow.core.model.ProcessStatus;

/**
 * Thrown when a lifecycle operation is not legal from the instance's current status.
 */
public class InvalidStateTransitionException extends ProcessEngineException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final ProcessStatus currentStatus;

    public InvalidStateTransitionException(ProcessStatus currentStatus, LifecycleOperation operation) {
        super(ERROR_CODE, String.format(
            "Operation %s is not allowed from status %s",
            operation.tag(), currentStatus
        ));
        this.currentStatus = currentStatus;
    }

    public ProcessStatus getCurrentStatus() {
        return currentStatus;
    }
}
