package com.riskradar.delegation.health;

import java.time.Instant;
import java.util.List;

/**
 * Body of a worker's health endpoint.
 */
public record WorkerHealthReport(
        String status,
        String name,
        String address,
        List<String> roles,
        double uptimeSeconds,
        long eventsProcessed,
        Instant timestamp
) {

    public static final String HEALTHY = "healthy";

    public boolean isHealthy() {
        return HEALTHY.equalsIgnoreCase(status);
    }
}
