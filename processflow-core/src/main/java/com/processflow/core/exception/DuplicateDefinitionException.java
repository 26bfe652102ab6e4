package com.processflow.core.exception;

/**
 * Thrown when a definition with the same name and version already exists.
 */
public class DuplicateDefinitionException extends ProcessEngineException {

    public static final String ERROR_CODE = "DUPLICATE_DEFINITION";

    public DuplicateDefinitionException(String name, String version) {
        super(ERROR_CODE, String.format(
            "A process definition named '%s' with version '%s' already exists",
            name, version
        ));
    }
}
