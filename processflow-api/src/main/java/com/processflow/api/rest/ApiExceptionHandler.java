package com.processflow.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.processflow.core.exception.AccessDeniedException;
import com.processflow.core.exception.DefinitionIntegrityException;
import com.processflow.core.exception.DefinitionValidationException;
import com.processflow.core.exception.InvalidStateTransitionException;
import com.processflow.core.exception.NotFoundException;
import com.processflow.core.exception.ProcessDefinitionNotInstantiableException;
import com.processflow.core.exception.ProcessEngineException;
import com.processflow.core.model.ProcessStatus;
import com.processflow.core.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps engine exceptions to HTTP responses with a stable error body.
 * Anything not matched more specifically is a conflict: duplicate or in-use
 * definitions and concurrent modifications.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return reject(HttpStatus.NOT_FOUND, e, null, null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return reject(HttpStatus.FORBIDDEN, e, null, null);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidStateTransitionException e) {
        return reject(HttpStatus.CONFLICT, e, e.getCurrentStatus(), null);
    }

    @ExceptionHandler(ProcessDefinitionNotInstantiableException.class)
    public ResponseEntity<ErrorResponse> handleNotInstantiable(ProcessDefinitionNotInstantiableException e) {
        List<Violation> violations = e.getViolations().isEmpty() ? null : e.getViolations();
        return reject(HttpStatus.UNPROCESSABLE_ENTITY, e, null, violations);
    }

    @ExceptionHandler(DefinitionValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(DefinitionValidationException e) {
        return reject(HttpStatus.UNPROCESSABLE_ENTITY, e, null, e.getViolations());
    }

    /**
     * The stored definition no longer matches a running instance.
     */
    @ExceptionHandler(DefinitionIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(DefinitionIntegrityException e) {
        log.error("Definition integrity error {}: {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(e, null, null));
    }

    @ExceptionHandler(ProcessEngineException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ProcessEngineException e) {
        return reject(HttpStatus.CONFLICT, e, null, null);
    }

    private static ResponseEntity<ErrorResponse> reject(HttpStatus status, ProcessEngineException e,
                                                        ProcessStatus currentStatus, List<Violation> violations) {
        log.debug("Rejected request with {}: {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.of(e, currentStatus, violations));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String errorCode,
        String message,
        ProcessStatus currentStatus,
        boolean retryable,
        List<Violation> violations
    ) {
        static ErrorResponse of(ProcessEngineException e, ProcessStatus currentStatus, List<Violation> violations) {
            return new ErrorResponse(e.getErrorCode(), e.getMessage(), currentStatus, e.isRetryable(), violations);
        }
    }
}
