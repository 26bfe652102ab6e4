package com.processflow.core.validation;

/**
 * Kinds of structural findings about a process definition graph.
 */
public enum ViolationType {
    // Errors: the definition cannot be activated or started
    EMPTY_DEFINITION(Severity.ERROR),
    NO_START_NODE(Severity.ERROR),
    MULTIPLE_START_NODES(Severity.ERROR),
    DUPLICATE_NODE_ID(Severity.ERROR),
    DANGLING_EDGE(Severity.ERROR),

    // Warnings: legal, but probably not what the author meant
    IMPLICIT_TERMINATOR(Severity.WARNING),
    UNREACHABLE_NODE(Severity.WARNING),
    END_NODE_WITH_CONNECTIONS(Severity.WARNING);

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;

    ViolationType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
