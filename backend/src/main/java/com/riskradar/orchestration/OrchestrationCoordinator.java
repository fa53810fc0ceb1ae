package com.riskradar.orchestration;

import com.riskradar.common.Scores;
import com.riskradar.delegation.DelegationOutcome;
import com.riskradar.delegation.DelegationStatus;
import com.riskradar.delegation.StageDelegationClient;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskAssessment;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.stage.DetectedPattern;
import com.riskradar.stage.EventAnalysisOutcome;
import com.riskradar.stage.EventAnalysisRequest;
import com.riskradar.stage.EventAnalysisStage;
import com.riskradar.stage.RiskAssessmentOutcome;
import com.riskradar.stage.RiskAssessmentRequest;
import com.riskradar.stage.RiskAssessmentStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Runs one batch through event analysis and risk assessment, delegating each stage to its worker and
 * falling back to local computation when a delegation does not succeed. Each stage finishes (or falls back)
 * before the next starts; per-event output keeps submission order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestrationCoordinator {

    private final StageDelegationClient delegationClient;
    private final RiskAssessmentStage riskStage;
    private final RiskAssessmentEngine engine;
    private final RequestIdGenerator requestIds;
    private final PipelineStatistics statistics;

    public BatchVerdict analyze(List<ProcessedEvent> events, String priority) {
        List<ProcessedEvent> batch = List.copyOf(events);
        PipelineRun run = new PipelineRun(requestIds.next(batch.size()));
        statistics.recordReceived();
        log.info("Batch {} received: {} events, priority {}", run.requestId(), batch.size(), priority);
        try {
            run.moveTo(PipelineState.ANALYZING_EVENTS);
            EventAnalysisOutcome analysis = analyzeEvents(run, batch, priority);

            run.moveTo(PipelineState.ASSESSING_RISK);
            RiskAssessmentRequest riskRequest = new RiskAssessmentRequest(
                    analysis.processedEvents(), analysis.patterns(), analysis.confidence(), priority);
            RiskAssessmentOutcome risk = assessRisk(run, riskRequest);

            run.moveTo(PipelineState.SYNTHESIZED);
            BatchVerdict verdict = synthesize(run, analysis, risk);
            run.moveTo(PipelineState.RESPONDED);
            verdict = withFinalState(verdict, run);
            statistics.recordResponded(verdict);
            log.info("Batch {} done: {} events, {} high risk, {} critical, score {}", run.requestId(),
                    verdict.totalEvents(), verdict.highRiskCount(), verdict.criticalCount(), verdict.overallScore());
            return verdict;
        } catch (RuntimeException e) {
            run.fail();
            statistics.recordError();
            log.error("Batch {} failed: {}", run.requestId(), e.getMessage(), e);
            return BatchVerdict.error(run, batch.size(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private EventAnalysisOutcome analyzeEvents(PipelineRun run, List<ProcessedEvent> events, String priority) {
        DelegationOutcome<EventAnalysisOutcome> outcome = delegate(WorkerRole.EVENT_ANALYZER, run, priority,
                new EventAnalysisRequest(events, priority), EventAnalysisOutcome.class);
        if (outcome.isSuccess()) {
            run.report(new StageReport(WorkerRole.EVENT_ANALYZER, DelegationStatus.SUCCESS, false, null));
            return completeAnalysis(run, events, outcome.result());
        }
        log.warn("Batch {}: event analysis {} ({}), using pass-through", run.requestId(), outcome.status(), outcome.message());
        statistics.recordFallback(WorkerRole.EVENT_ANALYZER);
        run.report(new StageReport(WorkerRole.EVENT_ANALYZER, outcome.status(), true, outcome.message()));
        return EventAnalysisStage.passThrough(events);
    }

    private RiskAssessmentOutcome assessRisk(PipelineRun run, RiskAssessmentRequest request) {
        DelegationOutcome<RiskAssessmentOutcome> outcome = delegate(WorkerRole.RISK_ASSESSOR, run, request.priority(),
                request, RiskAssessmentOutcome.class);
        if (outcome.isSuccess()) {
            run.report(new StageReport(WorkerRole.RISK_ASSESSOR, DelegationStatus.SUCCESS, false, null));
            return completeAssessment(run, request, outcome.result());
        }
        log.warn("Batch {}: risk assessment {} ({}), assessing locally", run.requestId(), outcome.status(), outcome.message());
        statistics.recordFallback(WorkerRole.RISK_ASSESSOR);
        run.report(new StageReport(WorkerRole.RISK_ASSESSOR, outcome.status(), true, outcome.message()));
        return riskStage.assess(request);
    }

    private <R> DelegationOutcome<R> delegate(WorkerRole role, PipelineRun run, String priority, Object payload,
                                              Class<R> resultType) {
        try {
            return delegationClient.delegate(role, run.requestId() + "-" + role.key(), priority, payload, resultType);
        } catch (RuntimeException e) {
            log.warn("Batch {}: delegation to {} failed unexpectedly: {}", run.requestId(), role.key(), e.getMessage());
            return DelegationOutcome.failed(DelegationStatus.ERROR, e.getMessage());
        }
    }

    /**
     * Aligns remote analysis output with the submitted events; events the worker left out pass through unchanged.
     */
    EventAnalysisOutcome completeAnalysis(PipelineRun run, List<ProcessedEvent> events, EventAnalysisOutcome remote) {
        List<ProcessedEvent> processed = remote.processedEvents();
        if (processed.size() == events.size() && sameEvents(events, processed)) {
            return remote;
        }
        Map<String, Deque<ProcessedEvent>> byKey = new HashMap<>();
        for (ProcessedEvent p : processed) {
            byKey.computeIfAbsent(eventKey(p), k -> new ArrayDeque<>()).add(p);
        }
        List<ProcessedEvent> aligned = new ArrayList<>(events.size());
        int missing = 0;
        for (ProcessedEvent event : events) {
            Deque<ProcessedEvent> candidates = byKey.get(eventKey(event));
            if (candidates != null && !candidates.isEmpty()) {
                aligned.add(candidates.poll());
            } else {
                aligned.add(EventAnalysisStage.passThrough(List.of(event)).processedEvents().get(0));
                missing++;
            }
        }
        if (missing > 0) {
            log.warn("Batch {}: event analysis returned no output for {} events, passed through", run.requestId(), missing);
        }
        return new EventAnalysisOutcome(aligned, remote.patterns(), remote.confidence(), remote.processingTimeSeconds());
    }

    /**
     * Aligns remote assessments with the request's events by hash and log index. Missing assessments and ones
     * whose score or confidence is outside [0,1] are replaced by a local assessment and the stage summary is rebuilt.
     */
    RiskAssessmentOutcome completeAssessment(PipelineRun run, RiskAssessmentRequest request, RiskAssessmentOutcome remote) {
        List<ProcessedEvent> events = request.events();
        List<RiskAssessment> assessments = remote.assessments();
        if (assessments.size() == events.size() && sameKeys(events, assessments)
                && assessments.stream().allMatch(OrchestrationCoordinator::inRange)) {
            return remote;
        }
        Map<String, Deque<RiskAssessment>> byKey = new HashMap<>();
        int rejected = 0;
        for (RiskAssessment a : assessments) {
            if (inRange(a)) {
                byKey.computeIfAbsent(assessmentKey(a), k -> new ArrayDeque<>()).add(a);
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            log.warn("Batch {}: dropped {} remote assessments with scores outside [0,1]", run.requestId(), rejected);
        }
        List<RiskAssessment> aligned = new ArrayList<>(events.size());
        int missing = 0;
        for (ProcessedEvent event : events) {
            Deque<RiskAssessment> candidates = byKey.get(eventKey(event));
            if (candidates != null && !candidates.isEmpty()) {
                aligned.add(candidates.poll());
            } else {
                aligned.add(engine.assess(event));
                missing++;
            }
        }
        if (missing > 0) {
            log.warn("Batch {}: risk assessment missing {} events, assessed locally", run.requestId(), missing);
        }
        return riskStage.summarize(request, aligned, remote.processingTimeSeconds());
    }

    private BatchVerdict synthesize(PipelineRun run, EventAnalysisOutcome analysis, RiskAssessmentOutcome risk) {
        List<ProcessedEvent> processed = analysis.processedEvents();
        List<RiskAssessment> assessments = risk.assessments();
        int highRisk = 0;
        int critical = 0;
        List<EventVerdict> verdicts = new ArrayList<>(assessments.size());
        for (int i = 0; i < assessments.size(); i++) {
            RiskAssessment a = assessments.get(i);
            ProcessedEvent event = processed.get(i);
            if (engine.isHighRisk(a.overallScore())) {
                highRisk++;
            }
            if (engine.isCritical(a.overallScore())) {
                critical++;
            }
            verdicts.add(new EventVerdict(event.transactionHash(), event.logIndex(), event.suspicionLevel(), a));
        }
        List<String> recommendations = new ArrayList<>(new LinkedHashSet<>(risk.recommendations()));
        List<DetectedPattern> patterns = analysis.patterns();
        double confidence = processed.isEmpty() ? 0.0 : (analysis.confidence() + risk.confidence()) / 2.0;
        double processingTime = analysis.processingTimeSeconds() + risk.processingTimeSeconds();
        return new BatchVerdict(BatchVerdict.Status.SUCCESS, run.requestId(), run.state(), run.trail(), run.stages(),
                processed.size(), highRisk, critical, patterns, recommendations, risk.overallScore(), confidence,
                processingTime, verdicts, null);
    }

    private static BatchVerdict withFinalState(BatchVerdict v, PipelineRun run) {
        return new BatchVerdict(v.status(), v.requestId(), run.state(), run.trail(), v.stages(), v.totalEvents(),
                v.highRiskCount(), v.criticalCount(), v.patterns(), v.recommendations(), v.overallScore(),
                v.confidence(), v.processingTimeSeconds(), v.events(), v.errorMessage());
    }

    private static boolean sameEvents(List<ProcessedEvent> events, List<ProcessedEvent> processed) {
        for (int i = 0; i < events.size(); i++) {
            if (!eventKey(events.get(i)).equals(eventKey(processed.get(i)))) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameKeys(List<ProcessedEvent> events, List<RiskAssessment> assessments) {
        for (int i = 0; i < events.size(); i++) {
            if (!eventKey(events.get(i)).equals(assessmentKey(assessments.get(i)))) {
                return false;
            }
        }
        return true;
    }

    private static boolean inRange(RiskAssessment a) {
        return a != null && Scores.isUnitInterval(a.overallScore()) && Scores.isUnitInterval(a.overallConfidence());
    }

    private static String eventKey(ProcessedEvent event) {
        return event.transactionHash() + "#" + event.logIndex();
    }

    private static String assessmentKey(RiskAssessment assessment) {
        return assessment.transactionHash() + "#" + assessment.logIndex();
    }
}
