package com.riskradar.delegation;

import lombok.Getter;

/**
 * The worker answered with an ERROR message, or with a result that could not be read.
 */
@Getter
public class DelegationRemoteException extends DelegationException {

    private final String errorType;

    public DelegationRemoteException(WorkerRole role, String errorType, String message) {
        super(role, message);
        this.errorType = errorType;
    }

    public DelegationRemoteException(WorkerRole role, String errorType, String message, Throwable cause) {
        super(role, message, cause);
        this.errorType = errorType;
    }
}
