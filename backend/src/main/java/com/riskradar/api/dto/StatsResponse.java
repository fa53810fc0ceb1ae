package com.riskradar.api.dto;

import com.riskradar.cache.CacheStatistics;
import com.riskradar.delegation.DelegationStatus;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealth;
import com.riskradar.orchestration.PipelineStatistics;

import java.util.Map;

/**
 * GET /api/v1/stats response.
 *
 * @param delegations  per-role delegation outcome counters
 * @param worker       counters of this node acting as a worker
 * @param configuration thresholds and weights in effect
 */
public record StatsResponse(
        PipelineStatistics.Snapshot pipeline,
        Map<WorkerRole, Map<DelegationStatus, Long>> delegations,
        long droppedMessages,
        CacheStatistics cache,
        WorkerCounters worker,
        Map<WorkerRole, WorkerHealth> workers,
        Map<String, Object> configuration
) {

    public record WorkerCounters(boolean enabled, long requestsReceived, long errorsReported) {
    }
}
