package com.processflow.core.exception;

import com.processflow.core.validation.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a process definition fails structural validation
 * at a point where it must be valid (activation).
 */
public class DefinitionValidationException extends ProcessEngineException {

    public static final String ERROR_CODE = "DEFINITION_VALIDATION_FAILED";

    private final List<Violation> violations;

    public DefinitionValidationException(String definitionName, List<Violation> violations) {
        super(ERROR_CODE, String.format(
            "Invalid process definition '%s': %s",
            definitionName,
            violations.stream().map(Violation::message).collect(Collectors.joining("; "))
        ));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
