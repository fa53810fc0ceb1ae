package com.riskradar.api.controller;

import com.riskradar.api.dto.AnalyzeEventsRequest;
import com.riskradar.api.dto.EventPayload;
import com.riskradar.domain.EventType;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.orchestration.BatchVerdict;
import com.riskradar.orchestration.OrchestrationCoordinator;
import com.riskradar.orchestration.PipelineState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    OrchestrationCoordinator coordinator;

    @Test
    @DisplayName("SUCCESS verdict is 200, trimmed events reach the coordinator with the default priority")
    void successIsOk() {
        AnalysisController controller = new AnalysisController(coordinator, Runnable::run);
        BatchVerdict verdict = verdict(BatchVerdict.Status.SUCCESS, PipelineState.RESPONDED, null);
        when(coordinator.analyze(anyList(), eq("normal"))).thenReturn(verdict);
        EventPayload payload = new EventPayload(" 0xabc ", 1L, 0, null, EventType.TRANSFER, Map.of(), null, null, null);

        StepVerifier.create(controller.analyzeEvents(new AnalyzeEventsRequest(List.of(payload), null)))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody()).isSameAs(verdict);
                })
                .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ProcessedEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(coordinator).analyze(events.capture(), eq("normal"));
        assertThat(events.getValue()).extracting(ProcessedEvent::transactionHash).containsExactly("0xabc");
    }

    @Test
    @DisplayName("ERROR verdict is returned as 500 with its body")
    void errorIsServerError() {
        AnalysisController controller = new AnalysisController(coordinator, Runnable::run);
        BatchVerdict verdict = verdict(BatchVerdict.Status.ERROR, PipelineState.ERROR, "boom");
        when(coordinator.analyze(anyList(), eq("critical"))).thenReturn(verdict);
        EventPayload payload = new EventPayload("0xdef", 1L, 0, null, EventType.APPROVAL, null, null, null, null);

        StepVerifier.create(controller.analyzeEvents(new AnalyzeEventsRequest(List.of(payload), "critical")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                    assertThat(response.getBody().errorMessage()).isEqualTo("boom");
                })
                .verifyComplete();
    }

    private static BatchVerdict verdict(BatchVerdict.Status status, PipelineState state, String error) {
        return new BatchVerdict(status, "req-1", state, List.of(PipelineState.RECEIVED, state), List.of(), 1,
                0, 0, List.of(), List.of(), 0.0, 0.0, 0.0, List.of(), error);
    }
}
