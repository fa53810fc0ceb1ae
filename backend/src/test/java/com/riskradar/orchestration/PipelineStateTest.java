package com.riskradar.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateTest {

    @Test
    @DisplayName("states advance one step at a time and ERROR is reachable from every live state")
    void transitions() {
        assertThat(PipelineState.RECEIVED.canMoveTo(PipelineState.ANALYZING_EVENTS)).isTrue();
        assertThat(PipelineState.RECEIVED.canMoveTo(PipelineState.ASSESSING_RISK)).isFalse();
        assertThat(PipelineState.SYNTHESIZED.canMoveTo(PipelineState.RESPONDED)).isTrue();
        for (PipelineState state : PipelineState.values()) {
            assertThat(state.canMoveTo(PipelineState.ERROR)).isEqualTo(!state.isTerminal());
        }
        assertThat(PipelineState.RESPONDED.canMoveTo(PipelineState.RECEIVED)).isFalse();
    }

    @Test
    @DisplayName("run rejects skipped states and fails at most once")
    void run() {
        PipelineRun run = new PipelineRun("req-1");

        assertThatThrownBy(() -> run.moveTo(PipelineState.SYNTHESIZED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RECEIVED -> SYNTHESIZED");

        run.moveTo(PipelineState.ANALYZING_EVENTS);
        run.fail();
        run.fail();

        assertThat(run.state()).isEqualTo(PipelineState.ERROR);
        assertThat(run.trail()).containsExactly(PipelineState.RECEIVED, PipelineState.ANALYZING_EVENTS,
                PipelineState.ERROR);
    }
}
