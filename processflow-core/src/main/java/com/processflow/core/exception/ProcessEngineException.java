package com.processflow.core.exception;

/**
 * Base exception for all process engine errors.
 * Every subclass carries a stable error code that callers can switch on.
 */
public class ProcessEngineException extends RuntimeException {

    private final String errorCode;

    public ProcessEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ProcessEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may safely re-read and reapply the operation.
     */
    public boolean isRetryable() {
        return false;
    }
}
