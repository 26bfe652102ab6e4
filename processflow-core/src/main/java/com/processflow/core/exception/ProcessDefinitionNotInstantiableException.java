package com.processflow.core.exception;

import com.processflow.core.validation.Violation;

import java.util.List;
import java.util.UUID;

/**
 * Thrown at start time when the definition is inactive or structurally invalid.
 */
public class ProcessDefinitionNotInstantiableException extends ProcessEngineException {

    public static final String ERROR_CODE = "NOT_INSTANTIABLE";

    private final List<Violation> violations;

    private ProcessDefinitionNotInstantiableException(String message, List<Violation> violations) {
        super(ERROR_CODE, message);
        this.violations = List.copyOf(violations);
    }

    public static ProcessDefinitionNotInstantiableException inactive(UUID definitionId) {
        return new ProcessDefinitionNotInstantiableException(
            "Process definition is not active: " + definitionId, List.of());
    }

    public static ProcessDefinitionNotInstantiableException invalid(UUID definitionId, List<Violation> violations) {
        return new ProcessDefinitionNotInstantiableException(
            "Process definition " + definitionId + " failed validation: " + violations.get(0).message(),
            violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
