package com.riskradar.api.dto;

import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealth;

import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/health response. Status is "healthy" when every configured worker is healthy, "degraded" otherwise;
 * a degraded coordinator still answers using local fallbacks.
 */
public record ServiceHealthResponse(
        String status,
        double uptimeSeconds,
        Map<WorkerRole, WorkerHealth> workers,
        Instant timestamp
) {
}
