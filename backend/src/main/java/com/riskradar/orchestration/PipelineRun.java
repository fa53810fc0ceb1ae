package com.riskradar.orchestration;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one coordinator run. Confined to the thread executing the pipeline.
 */
class PipelineRun {

    private final String requestId;
    private final List<PipelineState> trail = new ArrayList<>();
    private final List<StageReport> stages = new ArrayList<>();
    private PipelineState state = PipelineState.RECEIVED;

    PipelineRun(String requestId) {
        this.requestId = requestId;
        trail.add(state);
    }

    void moveTo(PipelineState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next + " for " + requestId);
        }
        state = next;
        trail.add(next);
    }

    /** Moves to ERROR unless already terminal. */
    void fail() {
        if (!state.isTerminal()) {
            state = PipelineState.ERROR;
            trail.add(state);
        }
    }

    void report(StageReport report) {
        stages.add(report);
    }

    String requestId() {
        return requestId;
    }

    PipelineState state() {
        return state;
    }

    List<PipelineState> trail() {
        return List.copyOf(trail);
    }

    List<StageReport> stages() {
        return List.copyOf(stages);
    }
}
