package com.riskradar.api.controller;

import com.riskradar.api.dto.ServiceHealthResponse;
import com.riskradar.api.dto.StatsResponse;
import com.riskradar.cache.ScoreCache;
import com.riskradar.delegation.DelegationStatistics;
import com.riskradar.delegation.StageDelegationClient;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealth;
import com.riskradar.delegation.health.WorkerHealthRegistry;
import com.riskradar.delegation.health.WorkerStatus;
import com.riskradar.orchestration.PipelineStatistics;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.risk.config.RiskProperties;
import com.riskradar.worker.StageWorkerService;
import com.riskradar.worker.WorkerProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only service surface: GET /health and GET /stats.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final WorkerHealthRegistry healthRegistry;
    private final StageDelegationClient delegationClient;
    private final PipelineStatistics pipelineStatistics;
    private final ScoreCache scoreCache;
    private final StageWorkerService workerService;
    private final WorkerProperties workerProperties;
    private final RiskAssessmentEngine engine;
    private final RiskProperties riskProperties;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(WorkerHealthRegistry healthRegistry, StageDelegationClient delegationClient,
                            PipelineStatistics pipelineStatistics, ScoreCache scoreCache,
                            StageWorkerService workerService, WorkerProperties workerProperties,
                            RiskAssessmentEngine engine, RiskProperties riskProperties, Clock clock) {
        this.healthRegistry = healthRegistry;
        this.delegationClient = delegationClient;
        this.pipelineStatistics = pipelineStatistics;
        this.scoreCache = scoreCache;
        this.workerService = workerService;
        this.workerProperties = workerProperties;
        this.engine = engine;
        this.riskProperties = riskProperties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/health")
    public ServiceHealthResponse health() {
        Map<WorkerRole, WorkerHealth> workers = healthRegistry.snapshot();
        boolean allHealthy = workers.values().stream()
                .allMatch(w -> w.status() == WorkerStatus.NOT_FOUND || w.isHealthy());
        Instant now = clock.instant();
        return new ServiceHealthResponse(allHealthy ? "healthy" : "degraded",
                Duration.between(startedAt, now).toMillis() / 1000.0, workers, now);
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        DelegationStatistics delegations = delegationClient.statistics();
        return new StatsResponse(
                pipelineStatistics.snapshot(),
                delegations.snapshot(),
                delegations.droppedMessages(),
                scoreCache.statistics(),
                new StatsResponse.WorkerCounters(workerProperties.isEnabled(), workerService.requestsReceived(),
                        workerService.errorsReported()),
                healthRegistry.snapshot(),
                configurationSummary());
    }

    private Map<String, Object> configurationSummary() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("minConfidence", riskProperties.getMinConfidence());
        config.put("highRiskThreshold", riskProperties.getHighRiskThreshold());
        config.put("criticalRiskThreshold", riskProperties.getCriticalRiskThreshold());
        config.put("investigateThreshold", riskProperties.getInvestigateThreshold());
        Map<String, Double> weights = new LinkedHashMap<>();
        engine.categories().forEach(c -> weights.put(c.key(), riskProperties.weightOf(c)));
        config.put("weights", weights);
        return config;
    }
}
