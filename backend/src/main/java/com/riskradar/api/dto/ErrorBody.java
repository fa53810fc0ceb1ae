package com.riskradar.api.dto;

import java.time.Instant;

/**
 * Error response body: error code, human-readable message, timestamp (ISO 8601).
 * Used for validation 400s, disabled worker endpoints and unknown delegation replies.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
