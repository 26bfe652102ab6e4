package com.processflow.core.exception;

import java.util.UUID;

/**
 * Thrown when deleting a definition that still has running or suspended instances.
 */
public class DefinitionInUseException extends ProcessEngineException {

    public static final String ERROR_CODE = "DEFINITION_IN_USE";

    public DefinitionInUseException(UUID definitionId, long activeInstances) {
        super(ERROR_CODE, String.format(
            "Cannot delete process definition %s: %d active instance(s)",
            definitionId, activeInstances
        ));
    }
}
