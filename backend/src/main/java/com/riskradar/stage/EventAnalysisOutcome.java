package com.riskradar.stage;

import com.riskradar.domain.ProcessedEvent;

import java.util.List;

/**
 * Output of the event analysis stage.
 *
 * @param processedEvents input events enriched with suspicion level and risk factors, in input order
 */
public record EventAnalysisOutcome(
        List<ProcessedEvent> processedEvents,
        List<DetectedPattern> patterns,
        double confidence,
        double processingTimeSeconds
) {

    public EventAnalysisOutcome {
        processedEvents = processedEvents == null ? List.of() : List.copyOf(processedEvents);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
