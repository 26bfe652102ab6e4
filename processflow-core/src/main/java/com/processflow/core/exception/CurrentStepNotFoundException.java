package com.processflow.core.exception;

import java.util.UUID;

/**
 * Thrown when an instance's current step no longer exists in its definition.
 */
public class CurrentStepNotFoundException extends DefinitionIntegrityException {

    public static final String ERROR_CODE = "CURRENT_STEP_NOT_FOUND";

    public CurrentStepNotFoundException(UUID instanceId, UUID definitionId, String currentStep) {
        super(ERROR_CODE, String.format(
            "Current step '%s' of process instance %s not found in definition %s",
            currentStep, instanceId, definitionId
        ));
    }
}
