package com.riskradar.delegation;

/**
 * The worker could not be contacted (connection refused, DNS, non-2xx on delivery).
 */
public class DelegationUnreachableException extends DelegationException {

    public DelegationUnreachableException(WorkerRole role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
