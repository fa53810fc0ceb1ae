package com.riskradar.api.controller;

import com.riskradar.api.dto.AnalyzeEventsRequest;
import com.riskradar.api.dto.EventPayload;
import com.riskradar.config.AsyncConfig;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.orchestration.BatchVerdict;
import com.riskradar.orchestration.OrchestrationCoordinator;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * POST /analyze-events. The pipeline blocks on stage delegation, so it runs on the analysis executor.
 * ERROR verdicts are returned with status 500.
 */
@RestController
@RequestMapping("/api/v1")
public class AnalysisController {

    private final OrchestrationCoordinator coordinator;
    private final Scheduler analysisScheduler;

    public AnalysisController(OrchestrationCoordinator coordinator,
                              @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor analysisExecutor) {
        this.coordinator = coordinator;
        this.analysisScheduler = Schedulers.fromExecutor(analysisExecutor);
    }

    @PostMapping("/analyze-events")
    public Mono<ResponseEntity<BatchVerdict>> analyzeEvents(@RequestBody @Valid AnalyzeEventsRequest request) {
        List<ProcessedEvent> events = request.events().stream().map(EventPayload::toEvent).toList();
        return Mono.fromCallable(() -> coordinator.analyze(events, request.priorityOrDefault()))
                .subscribeOn(analysisScheduler)
                .map(verdict -> verdict.status() == BatchVerdict.Status.SUCCESS
                        ? ResponseEntity.ok(verdict)
                        : ResponseEntity.internalServerError().body(verdict));
    }
}
