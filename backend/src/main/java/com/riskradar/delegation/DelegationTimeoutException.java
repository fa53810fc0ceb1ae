package com.riskradar.delegation;

public class DelegationTimeoutException extends DelegationException {

    public DelegationTimeoutException(WorkerRole role, String message) {
        super(role, message);
    }

    public DelegationTimeoutException(WorkerRole role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
