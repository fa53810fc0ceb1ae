package com.riskradar.stage;

import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskAssessment;
import com.riskradar.risk.RiskAssessmentEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Risk assessment stage: one engine assessment per event, critical events, recommendations and the stage
 * confidence. The same code runs on a {@code risk_assessor} worker and as the coordinator's local fallback,
 * so both paths produce identical output for identical input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RiskAssessmentStage {

    private static final double ANALYSIS_CONFIDENCE_WEIGHT = 0.4;
    private static final double ASSESSMENT_CONFIDENCE_WEIGHT = 0.6;

    private final RiskAssessmentEngine engine;
    private final Clock clock;

    public RiskAssessmentOutcome assess(RiskAssessmentRequest request) {
        long started = clock.millis();
        List<RiskAssessment> assessments = new ArrayList<>(request.events().size());
        for (ProcessedEvent event : request.events()) {
            assessments.add(engine.assess(event));
        }
        RiskAssessmentOutcome outcome = summarize(request, assessments, (clock.millis() - started) / 1000.0);
        log.info("Assessed {} events: {} critical, overall score {}", assessments.size(),
                outcome.criticalEvents().size(), outcome.overallScore());
        return outcome;
    }

    /**
     * Builds the stage output from per-event assessments aligned with {@code request.events()}.
     */
    public RiskAssessmentOutcome summarize(RiskAssessmentRequest request, List<RiskAssessment> assessments,
                                           double processingTimeSeconds) {
        List<CriticalEvent> critical = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        double scoreSum = 0.0;
        double confidenceSum = 0.0;
        for (int i = 0; i < assessments.size(); i++) {
            RiskAssessment a = assessments.get(i);
            ProcessedEvent event = request.events().get(i);
            scoreSum += a.overallScore();
            confidenceSum += a.overallConfidence();
            if (engine.isCritical(a.overallScore())) {
                critical.add(new CriticalEvent(a.transactionHash(), a.overallScore(), a.recommendation(), a.factors()));
                recommendations.add("CRITICAL: " + a.recommendation() + " for " + event.shortHash());
            } else if (engine.isHighRisk(a.overallScore())) {
                recommendations.add("HIGH RISK: " + a.recommendation() + " for " + event.shortHash());
            }
        }
        recommendations.addAll(patternRecommendations(request.patterns()));

        double overall = assessments.isEmpty() ? 0.0 : scoreSum / assessments.size();
        double confidence = assessments.isEmpty()
                ? 0.0
                : Math.min(1.0, ANALYSIS_CONFIDENCE_WEIGHT * request.analysisConfidence()
                        + ASSESSMENT_CONFIDENCE_WEIGHT * (confidenceSum / assessments.size()));
        return new RiskAssessmentOutcome(assessments, critical, recommendations, overall, confidence, processingTimeSeconds);
    }

    static List<String> patternRecommendations(List<DetectedPattern> patterns) {
        List<String> recommendations = new ArrayList<>();
        for (DetectedPattern pattern : patterns) {
            switch (pattern.patternType()) {
                case PatternDetector.LARGE_TRANSFER ->
                        recommendations.add("Monitor large transfer: " + pattern.description());
                case PatternDetector.UNLIMITED_APPROVAL ->
                        recommendations.add("IMMEDIATE ACTION: Unlimited approval detected - potential exploit risk");
                case PatternDetector.ZERO_ADDRESS_INTERACTION ->
                        recommendations.add("Investigate zero address interaction - may indicate contract creation or destruction");
                case PatternDetector.CRITICAL_SUSPICION ->
                        recommendations.add("CRITICAL: " + pattern.description());
                case PatternDetector.MULTIPLE_RISK_FACTORS ->
                        recommendations.add("High complexity event: " + pattern.description());
                default -> {
                }
            }
        }
        return recommendations;
    }
}
