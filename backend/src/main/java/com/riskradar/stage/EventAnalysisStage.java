package com.riskradar.stage;

import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskAssessment;
import com.riskradar.domain.SuspicionLevel;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.risk.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Event analysis stage: classifies each event's suspicion from an engine pass, merges risk factor tags
 * and detects patterns. Run by a worker serving {@code event_analyzer}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventAnalysisStage {

    /** Confidence of the local pass-through used when the remote stage is unavailable. */
    public static final double PASS_THROUGH_CONFIDENCE = 0.5;

    private static final double BASE_CONFIDENCE = 0.7;
    private static final double PATTERN_BOOST = 0.1;
    private static final double MAX_PATTERN_BOOST = 0.3;
    private static final double DATA_QUALITY_BOOST = 0.05;

    /** Tags listed first, in this order, when factor lists are merged; the rest follow alphabetically. */
    static final List<String> FACTOR_PRIORITY = List.of(
            "CRITICAL_FINANCIAL_IMPACT",
            "HIGH_FINANCIAL_IMPACT",
            "UNLIMITED_APPROVAL",
            "BEHAVIORAL_ANOMALY",
            "REPUTATION_RISK",
            "HIGH_ANOMALY_SCORE",
            "MEDIUM_FINANCIAL_IMPACT",
            "LARGE_APPROVAL",
            "MEDIUM_ANOMALY_SCORE",
            "LOW_FINANCIAL_IMPACT",
            "LOW_ANOMALY_SCORE");

    private final RiskAssessmentEngine engine;
    private final RiskProperties riskProperties;
    private final Clock clock;

    public EventAnalysisOutcome analyze(EventAnalysisRequest request) {
        long started = clock.millis();
        List<ProcessedEvent> processed = new ArrayList<>(request.events().size());
        List<DetectedPattern> patterns = new ArrayList<>();
        for (ProcessedEvent event : request.events()) {
            RiskAssessment assessment = engine.assess(event);
            SuspicionLevel mapped = suspicionFor(assessment);
            SuspicionLevel level = mapped.isAtLeast(event.suspicionLevel()) ? mapped : event.suspicionLevel();
            ProcessedEvent analyzed = event.withAnalysis(level, mergeFactors(event.riskFactors(), assessment.factors()));
            processed.add(analyzed);
            patterns.addAll(PatternDetector.detect(analyzed));
        }
        double confidence = confidence(processed, patterns);
        double seconds = (clock.millis() - started) / 1000.0;
        log.info("Analyzed {} events: {} patterns, confidence {}", processed.size(), patterns.size(), confidence);
        return new EventAnalysisOutcome(processed, patterns, confidence, seconds);
    }

    /**
     * Deterministic stand-in for the remote stage: events unchanged apart from suspicion LOW, no patterns.
     */
    public static EventAnalysisOutcome passThrough(List<ProcessedEvent> events) {
        List<ProcessedEvent> processed = events.stream()
                .map(e -> e.withAnalysis(SuspicionLevel.LOW, e.riskFactors()))
                .toList();
        return new EventAnalysisOutcome(processed, List.of(), events.isEmpty() ? 0.0 : PASS_THROUGH_CONFIDENCE, 0.0);
    }

    /**
     * Suspicion from an assessment. Below the minimum confidence the score is not trusted and LOW is returned.
     */
    SuspicionLevel suspicionFor(RiskAssessment assessment) {
        if (assessment.overallConfidence() < riskProperties.getMinConfidence()) {
            return SuspicionLevel.LOW;
        }
        double score = assessment.overallScore();
        if (score >= riskProperties.getCriticalRiskThreshold()) {
            return SuspicionLevel.CRITICAL;
        }
        if (score >= riskProperties.getHighRiskThreshold()) {
            return SuspicionLevel.HIGH;
        }
        if (score >= riskProperties.getInvestigateThreshold()) {
            return SuspicionLevel.MEDIUM;
        }
        return SuspicionLevel.LOW;
    }

    static List<String> mergeFactors(List<String> existing, List<String> found) {
        Set<String> remaining = new LinkedHashSet<>(existing);
        remaining.addAll(found);
        List<String> merged = new ArrayList<>();
        for (String tag : FACTOR_PRIORITY) {
            if (remaining.remove(tag)) {
                merged.add(tag);
            }
        }
        remaining.stream().sorted().forEach(merged::add);
        return merged;
    }

    static double confidence(List<ProcessedEvent> processed, List<DetectedPattern> patterns) {
        if (processed.isEmpty()) {
            return 0.0;
        }
        double patternBoost = Math.min(patterns.size() * PATTERN_BOOST, MAX_PATTERN_BOOST);
        double dataBoost = processed.stream().filter(ProcessedEvent::hasParsedArgs).count() * DATA_QUALITY_BOOST;
        return Math.min(BASE_CONFIDENCE + patternBoost + dataBoost, 1.0);
    }
}
