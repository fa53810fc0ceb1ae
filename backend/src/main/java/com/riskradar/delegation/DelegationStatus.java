package com.riskradar.delegation;

public enum DelegationStatus {
    SUCCESS,
    /** No acknowledgment or no result before the deadline. */
    TIMEOUT,
    /** Pre-flight health check failed; nothing was sent. */
    UNHEALTHY,
    /** Worker reported an error, could not be reached, or returned an unreadable result. */
    ERROR
}
