package com.processflow.core.validation;

import java.util.List;

/**
 * Outcome of validating a process definition.
 * Only errors make a definition invalid; warnings are advisory.
 */
public record ValidationResult(List<Violation> errors, List<Violation> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<Violation> findings) {
        return new ValidationResult(
            findings.stream().filter(Violation::isError).toList(),
            findings.stream().filter(v -> !v.isError()).toList()
        );
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(ViolationType type) {
        return errors.stream().anyMatch(v -> v.type() == type);
    }

    public boolean hasWarning(ViolationType type) {
        return warnings.stream().anyMatch(v -> v.type() == type);
    }
}
