package com.riskradar.delegation;

/**
 * Delegation protocol message kinds. A worker answers one REQUEST with one ACKNOWLEDGMENT followed by
 * exactly one RESULT or ERROR, all carrying the request id.
 */
public enum MessageType {
    REQUEST,
    ACKNOWLEDGMENT,
    RESULT,
    ERROR
}
