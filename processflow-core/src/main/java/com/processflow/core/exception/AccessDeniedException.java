package com.processflow.core.exception;

/**
 * Thrown when the caller has no scope over a process instance or definition.
 */
public class AccessDeniedException extends ProcessEngineException {

    public static final String ERROR_CODE = "ACCESS_DENIED";

    public AccessDeniedException(String entityType, String entityId, String actorId) {
        super(ERROR_CODE, String.format(
            "Access denied to %s %s for %s",
            entityType, entityId, actorId
        ));
    }
}
