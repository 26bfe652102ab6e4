package com.processflow.core.validation;

/**
 * A single validation finding. nodeId is null for definition-level findings.
 */
public record Violation(ViolationType type, String nodeId, String message) {

    public static Violation of(ViolationType type, String message) {
        return new Violation(type, null, message);
    }

    public static Violation atNode(ViolationType type, String nodeId, String message) {
        return new Violation(type, nodeId, message);
    }

    public boolean isError() {
        return type.isError();
    }
}
