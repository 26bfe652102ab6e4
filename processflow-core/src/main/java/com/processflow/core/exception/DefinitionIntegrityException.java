package com.processflow.core.exception;

/**
 * Data-integrity error: an instance and the definition it is bound to have drifted apart.
 * Fatal for the call that detects it; never a user error.
 */
public class DefinitionIntegrityException extends ProcessEngineException {

    public static final String ERROR_CODE = "DEFINITION_INTEGRITY";

    public DefinitionIntegrityException(String message) {
        super(ERROR_CODE, message);
    }

    protected DefinitionIntegrityException(String errorCode, String message) {
        super(errorCode, message);
    }
}
