package com.riskradar.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coordinator pipeline states. RESPONDED and ERROR are terminal; ERROR is reachable from every other state.
 */
public enum PipelineState {
    RECEIVED,
    ANALYZING_EVENTS,
    ASSESSING_RISK,
    SYNTHESIZED,
    RESPONDED,
    ERROR;

    public boolean isTerminal() {
        return this == RESPONDED || this == ERROR;
    }

    public boolean canMoveTo(PipelineState next) {
        return successors().contains(next);
    }

    private Set<PipelineState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(ANALYZING_EVENTS, ERROR);
            case ANALYZING_EVENTS -> EnumSet.of(ASSESSING_RISK, ERROR);
            case ASSESSING_RISK -> EnumSet.of(SYNTHESIZED, ERROR);
            case SYNTHESIZED -> EnumSet.of(RESPONDED, ERROR);
            case RESPONDED, ERROR -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
