package com.riskradar.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskradar.delegation.MessageType;
import com.riskradar.delegation.WorkerMessage;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealthReport;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.risk.config.RiskProperties;
import com.riskradar.stage.EventAnalysisOutcome;
import com.riskradar.stage.EventAnalysisRequest;
import com.riskradar.stage.EventAnalysisStage;
import com.riskradar.stage.RiskAssessmentOutcome;
import com.riskradar.stage.RiskAssessmentRequest;
import com.riskradar.stage.RiskAssessmentStage;
import com.riskradar.support.RecordingTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class StageWorkerServiceTest {

    private static final String REPLY_TO = "http://coordinator:8080";

    private final ObjectMapper mapper = objectMapper();
    private final RecordingTransport transport = new RecordingTransport();
    private final RiskAssessmentEngine engine = engine(cache());
    private final StageWorkerService worker;

    StageWorkerServiceTest() {
        WorkerProperties properties = new WorkerProperties();
        properties.setName("worker-a");
        properties.setAdvertisedAddress("http://worker-a:8080");
        worker = new StageWorkerService(new EventAnalysisStage(engine, new RiskProperties(), CLOCK),
                new RiskAssessmentStage(engine, CLOCK), transport, mapper, properties, CLOCK);
    }

    @Test
    @DisplayName("event analysis request is acknowledged, then answered with one RESULT")
    void eventAnalysis() throws Exception {
        ProcessedEvent event = transfer(txHash(1), ALICE, BOB, ONE_TOKEN);

        worker.handle(request("req-1", WorkerRole.EVENT_ANALYZER, new EventAnalysisRequest(List.of(event), "normal")));

        assertThat(transport.sent()).extracting(s -> s.message().type())
                .containsExactly(MessageType.ACKNOWLEDGMENT, MessageType.RESULT);
        assertThat(transport.sent()).extracting(RecordingTransport.Sent::target).containsOnly(REPLY_TO);
        WorkerMessage result = transport.sent().get(1).message();
        assertThat(result.sender()).isEqualTo("worker-a");
        assertThat(result.requestId()).isEqualTo("req-1");
        EventAnalysisOutcome outcome = mapper.treeToValue(result.payload(), EventAnalysisOutcome.class);
        assertThat(outcome.processedEvents()).extracting(ProcessedEvent::transactionHash).containsExactly(txHash(1));
        assertThat(result.confidence()).isEqualTo(outcome.confidence());
        assertThat(worker.healthReport().eventsProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("risk assessment request yields the same output as running the stage locally")
    void riskAssessment() throws Exception {
        RiskAssessmentRequest input = new RiskAssessmentRequest(
                List.of(transfer(txHash(2), ALICE, BOB, ONE_TOKEN)), List.of(), 0.7, "high");

        worker.handle(request("req-2", WorkerRole.RISK_ASSESSOR, input));

        WorkerMessage result = transport.sent().get(1).message();
        assertThat(result.type()).isEqualTo(MessageType.RESULT);
        RiskAssessmentOutcome remote = mapper.treeToValue(result.payload(), RiskAssessmentOutcome.class);
        RiskAssessmentOutcome local = new RiskAssessmentStage(engine, CLOCK).assess(input);
        assertThat(remote.overallScore()).isEqualTo(local.overallScore());
        assertThat(remote.confidence()).isEqualTo(local.confidence());
        assertThat(remote.recommendations()).isEqualTo(local.recommendations());
    }

    @Test
    @DisplayName("missing or unreadable payload is answered with INVALID_PAYLOAD")
    void invalidPayload() {
        worker.handle(WorkerMessage.request("req-3", WorkerRole.RISK_ASSESSOR, "coordinator", REPLY_TO, "normal",
                null, NOW));
        worker.handle(WorkerMessage.request("req-4", WorkerRole.EVENT_ANALYZER, "coordinator", REPLY_TO, "normal",
                mapper.valueToTree(List.of("not", "a", "request")), NOW));

        assertThat(transport.sent()).extracting(s -> s.message().type()).containsExactly(
                MessageType.ACKNOWLEDGMENT, MessageType.ERROR, MessageType.ACKNOWLEDGMENT, MessageType.ERROR);
        assertThat(transport.sent().get(1).message().errorType()).isEqualTo("INVALID_PAYLOAD");
        assertThat(transport.sent().get(3).message().errorType()).isEqualTo("INVALID_PAYLOAD");
        assertThat(worker.errorsReported()).isEqualTo(2);
    }

    @Test
    @DisplayName("messages that are not well-formed requests are ignored")
    void malformedIgnored() {
        WorkerMessage ack = WorkerMessage.request("req-5", WorkerRole.EVENT_ANALYZER, "coordinator", REPLY_TO,
                "normal", null, NOW).acknowledge("other", "hi", NOW);
        WorkerMessage noReplyTo = WorkerMessage.request("req-6", WorkerRole.EVENT_ANALYZER, "coordinator", null,
                "normal", null, NOW);

        worker.handle(ack);
        worker.handle(noReplyTo);

        assertThat(transport.sent()).isEmpty();
        assertThat(worker.requestsReceived()).isZero();
    }

    @Test
    @DisplayName("health report names the worker and every role it serves")
    void healthReport() {
        WorkerHealthReport report = worker.healthReport();

        assertThat(report.isHealthy()).isTrue();
        assertThat(report.name()).isEqualTo("worker-a");
        assertThat(report.address()).isEqualTo("http://worker-a:8080");
        assertThat(report.roles()).containsExactly("event_analyzer", "risk_assessor");
        assertThat(report.uptimeSeconds()).isZero();
    }

    private WorkerMessage request(String id, WorkerRole role, Object payload) {
        return WorkerMessage.request(id, role, "coordinator", REPLY_TO, "normal", mapper.valueToTree(payload), NOW);
    }
}
