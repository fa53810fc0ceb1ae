package com.riskradar.support;

import com.riskradar.delegation.DelegationUnreachableException;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealthProbe;
import com.riskradar.delegation.health.WorkerHealthReport;

import java.time.Duration;
import java.util.List;

/**
 * Health probe that reports every worker healthy, or every worker unreachable.
 */
public final class FixedHealthProbe {

    private FixedHealthProbe() {
    }

    public static WorkerHealthProbe healthy() {
        return (role, address, timeout) -> new WorkerHealthReport(WorkerHealthReport.HEALTHY, "stub-" + role.key(),
                address, List.of(role.key()), 120.0, 7, TestFixtures.NOW);
    }

    public static WorkerHealthProbe unreachable() {
        return (WorkerRole role, String address, Duration timeout) -> {
            throw new DelegationUnreachableException(role, "Connection refused: " + address, null);
        };
    }
}
