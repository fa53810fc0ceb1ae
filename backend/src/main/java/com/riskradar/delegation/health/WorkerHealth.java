package com.riskradar.delegation.health;

import com.riskradar.delegation.WorkerRole;

import java.time.Instant;

/**
 * Last known state of one stage worker. Replaced wholesale on every check.
 *
 * @param lastHeartbeat   time of the last successful probe, null if never reached
 * @param eventsProcessed as reported by the worker on the last successful probe
 */
public record WorkerHealth(
        WorkerRole role,
        String address,
        WorkerStatus status,
        Instant lastHeartbeat,
        long eventsProcessed,
        double uptimeSeconds,
        Instant checkedAt,
        String detail
) {

    public boolean isHealthy() {
        return status == WorkerStatus.HEALTHY;
    }
}
