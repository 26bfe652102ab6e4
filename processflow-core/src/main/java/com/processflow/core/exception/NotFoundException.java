package com.processflow.core.exception;

/**
 * Thrown when a process definition or instance id does not resolve.
 */
public class NotFoundException extends ProcessEngineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
