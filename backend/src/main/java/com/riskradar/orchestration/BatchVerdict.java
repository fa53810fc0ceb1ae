package com.riskradar.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskradar.stage.DetectedPattern;

import java.util.List;

/**
 * Coordinator answer for one batch. On ERROR only the request id, state trail, stage reports and message are set.
 *
 * @param events per-event verdicts in submission order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchVerdict(
        Status status,
        String requestId,
        PipelineState finalState,
        List<PipelineState> stateTrail,
        List<StageReport> stages,
        int totalEvents,
        int highRiskCount,
        int criticalCount,
        List<DetectedPattern> patterns,
        List<String> recommendations,
        double overallScore,
        double confidence,
        double processingTimeSeconds,
        List<EventVerdict> events,
        String errorMessage
) {

    public enum Status {
        SUCCESS,
        ERROR
    }

    public BatchVerdict {
        stateTrail = stateTrail == null ? List.of() : List.copyOf(stateTrail);
        stages = stages == null ? List.of() : List.copyOf(stages);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        events = events == null ? List.of() : List.copyOf(events);
    }

    static BatchVerdict error(PipelineRun run, int totalEvents, String message) {
        return new BatchVerdict(Status.ERROR, run.requestId(), run.state(), run.trail(), run.stages(), totalEvents,
                0, 0, List.of(), List.of(), 0.0, 0.0, 0.0, List.of(), message);
    }
}
