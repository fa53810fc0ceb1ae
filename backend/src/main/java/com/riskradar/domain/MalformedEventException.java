package com.riskradar.domain;

/**
 * Thrown when a processed event carries an argument that cannot be interpreted (e.g. a non-numeric value).
 * Analyzers degrade to a minimal-impact result instead of rejecting the event.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
