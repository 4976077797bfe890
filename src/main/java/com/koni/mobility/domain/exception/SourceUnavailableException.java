package com.koni.mobility.domain.exception;

/**
 * Exception thrown when an external source is temporarily unreachable:
 * IO errors, timeouts, HTTP 5xx and HTTP 429. Retryable.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
