package com.riskradar.stage;

import com.riskradar.domain.ProcessedEvent;

import java.util.List;

/**
 * Input of the risk assessment stage: the analysis stage's events and patterns, and its confidence.
 */
public record RiskAssessmentRequest(
        List<ProcessedEvent> events,
        List<DetectedPattern> patterns,
        double analysisConfidence,
        String priority
) {

    public RiskAssessmentRequest {
        events = events == null ? List.of() : List.copyOf(events);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
