package com.riskradar.delegation.health;

public enum WorkerStatus {
    /** Not checked yet. */
    UNKNOWN,
    HEALTHY,
    /** Answered with a non-healthy status or did not answer within the probe timeout. */
    UNHEALTHY,
    /** Connection failed. */
    UNREACHABLE,
    /** No address configured for the role. */
    NOT_FOUND
}
