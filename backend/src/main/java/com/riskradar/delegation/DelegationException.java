package com.riskradar.delegation;

import lombok.Getter;

/**
 * A delegation to a remote stage worker did not produce a usable result. Callers fall back to local computation.
 */
@Getter
public class DelegationException extends RuntimeException {

    private final WorkerRole role;

    public DelegationException(WorkerRole role, String message) {
        super(message);
        this.role = role;
    }

    public DelegationException(WorkerRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }
}
