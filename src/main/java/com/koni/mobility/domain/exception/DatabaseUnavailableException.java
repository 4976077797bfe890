package com.koni.mobility.domain.exception;

/**
 * Exception thrown when the store cannot be reached or a transient persistence failure occurs.
 * Pipelines retry the failed stage with their bounded policy before abandoning the tick.
 */
public class DatabaseUnavailableException extends RuntimeException {

    public DatabaseUnavailableException(String message) {
        super(message);
    }

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
