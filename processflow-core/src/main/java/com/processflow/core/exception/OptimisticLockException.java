package com.processflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a process instance was modified between read and conditional write.
 * Safe to retry by re-reading the instance and reapplying the operation.
 */
public class OptimisticLockException extends ProcessEngineException {

    public static final String ERROR_CODE = "CONCURRENT_MODIFICATION";

    public OptimisticLockException(UUID instanceId, long expectedSequence, long actualSequence) {
        super(ERROR_CODE, String.format(
            "Process instance %s was modified concurrently: expected sequence %d, actual sequence %d",
            instanceId, expectedSequence, actualSequence
        ));
    }

    public OptimisticLockException(UUID instanceId, long expectedSequence) {
        super(ERROR_CODE, String.format(
            "Process instance %s was modified concurrently: expected sequence %d",
            instanceId, expectedSequence
        ));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
