package com.koni.mobility.domain.exception;

/**
 * Exception thrown when a domain object does not satisfy its required fields.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
