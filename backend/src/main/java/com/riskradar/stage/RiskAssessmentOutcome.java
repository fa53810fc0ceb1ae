package com.riskradar.stage;

import com.riskradar.domain.RiskAssessment;

import java.util.List;

/**
 * Output of the risk assessment stage.
 *
 * @param assessments  one per input event, in input order
 * @param overallScore mean of the per-event scores
 * @param confidence   0.4 x analysis confidence + 0.6 x mean assessment confidence
 */
public record RiskAssessmentOutcome(
        List<RiskAssessment> assessments,
        List<CriticalEvent> criticalEvents,
        List<String> recommendations,
        double overallScore,
        double confidence,
        double processingTimeSeconds
) {

    public RiskAssessmentOutcome {
        assessments = assessments == null ? List.of() : List.copyOf(assessments);
        criticalEvents = criticalEvents == null ? List.of() : List.copyOf(criticalEvents);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
