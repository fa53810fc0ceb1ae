package com.riskradar.delegation.health;

import com.riskradar.delegation.WorkerRole;

import java.time.Duration;

/**
 * Fetches a worker's health report.
 */
public interface WorkerHealthProbe {

    /**
     * @throws com.riskradar.delegation.DelegationTimeoutException     no answer within {@code timeout}
     * @throws com.riskradar.delegation.DelegationUnreachableException connection failure
     * @throws com.riskradar.delegation.DelegationRemoteException      non-2xx answer or unreadable body
     */
    WorkerHealthReport probe(WorkerRole role, String address, Duration timeout);
}
