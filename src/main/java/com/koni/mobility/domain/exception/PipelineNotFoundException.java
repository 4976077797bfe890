package com.koni.mobility.domain.exception;

/**
 * Exception thrown when an operation names a pipeline that is not registered.
 */
public class PipelineNotFoundException extends RuntimeException {

    public PipelineNotFoundException(String message) {
        super(message);
    }

    public PipelineNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
