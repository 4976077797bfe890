package com.koni.mobility.domain.exception;

/**
 * Exception thrown when a source answers with a payload that cannot be decoded,
 * or with a response shape the adapter does not understand. Not retried.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
