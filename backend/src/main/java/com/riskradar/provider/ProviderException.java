package com.riskradar.provider;

/**
 * A fact provider call failed (HTTP error, local rate limit, unexpected payload).
 * The score cache treats it as "no data".
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
