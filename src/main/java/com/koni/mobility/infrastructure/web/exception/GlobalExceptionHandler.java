package com.koni.mobility.infrastructure.web.exception;

import com.koni.mobility.domain.exception.DatabaseUnavailableException;
import com.koni.mobility.domain.exception.PipelineNotFoundException;
import com.koni.mobility.domain.exception.ValidationException;
import com.koni.mobility.infrastructure.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions raised by the operations API to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles PipelineNotFoundException and returns 404 Not Found.
     */
    @ExceptionHandler(PipelineNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePipelineNotFound(PipelineNotFoundException ex) {
        log.warn("Pipeline not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    /**
     * Handles ValidationException and returns 400 Bad Request.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Returns 503 while the store is unreachable, e.g. when reading watermarks.
     */
    @ExceptionHandler(DatabaseUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseUnavailableException(DatabaseUnavailableException ex) {
        log.error("Database unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    /**
     * Handles anything else and returns 500 without exposing the cause.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
    }
}
