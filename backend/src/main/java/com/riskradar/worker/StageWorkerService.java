package com.riskradar.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskradar.config.AsyncConfig;
import com.riskradar.delegation.DelegationException;
import com.riskradar.delegation.MessageType;
import com.riskradar.delegation.WorkerMessage;
import com.riskradar.delegation.WorkerMessageTransport;
import com.riskradar.delegation.WorkerRole;
import com.riskradar.delegation.health.WorkerHealthReport;
import com.riskradar.stage.EventAnalysisOutcome;
import com.riskradar.stage.EventAnalysisRequest;
import com.riskradar.stage.EventAnalysisStage;
import com.riskradar.stage.RiskAssessmentOutcome;
import com.riskradar.stage.RiskAssessmentRequest;
import com.riskradar.stage.RiskAssessmentStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves stage requests when this node acts as a worker: acknowledges, runs the stage for the requested role,
 * then posts exactly one RESULT or ERROR to the requester's reply address.
 */
@Service
@Slf4j
public class StageWorkerService {

    private final EventAnalysisStage eventAnalysisStage;
    private final RiskAssessmentStage riskAssessmentStage;
    private final WorkerMessageTransport transport;
    private final ObjectMapper objectMapper;
    private final WorkerProperties properties;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong requestsReceived = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong errorsReported = new AtomicLong();

    public StageWorkerService(EventAnalysisStage eventAnalysisStage, RiskAssessmentStage riskAssessmentStage,
                              WorkerMessageTransport transport, ObjectMapper objectMapper,
                              WorkerProperties properties, Clock clock) {
        this.eventAnalysisStage = eventAnalysisStage;
        this.riskAssessmentStage = riskAssessmentStage;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Async(AsyncConfig.WORKER_EXECUTOR)
    public void handleAsync(WorkerMessage request) {
        handle(request);
    }

    /**
     * Processes one REQUEST synchronously. Failures to deliver the reply are logged; the requester's timeout
     * covers them.
     */
    public void handle(WorkerMessage request) {
        if (request.type() != MessageType.REQUEST || request.replyTo() == null || request.role() == null) {
            log.warn("Ignoring malformed worker message {} ({})", request.requestId(), request.type());
            return;
        }
        requestsReceived.incrementAndGet();
        String name = properties.getName();
        WorkerMessage reply;
        try {
            deliver(request, request.acknowledge(name, name + " accepted " + request.role().key() + " request",
                    clock.instant()));
            reply = run(request);
        } catch (DelegationException e) {
            log.warn("Could not acknowledge {}: {}", request.requestId(), e.getMessage());
            return;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            errorsReported.incrementAndGet();
            reply = request.error(name, "INVALID_PAYLOAD", e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            errorsReported.incrementAndGet();
            log.error("Stage {} failed for {}", request.role().key(), request.requestId(), e);
            reply = request.error(name, e.getClass().getSimpleName(), String.valueOf(e.getMessage()), clock.instant());
        }
        try {
            deliver(request, reply);
        } catch (DelegationException e) {
            log.warn("Could not deliver {} for {}: {}", reply.type(), request.requestId(), e.getMessage());
        }
    }

    public WorkerHealthReport healthReport() {
        double uptime = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        return new WorkerHealthReport(WorkerHealthReport.HEALTHY, properties.getName(),
                properties.getAdvertisedAddress(),
                Arrays.stream(WorkerRole.values()).map(WorkerRole::key).toList(),
                uptime, eventsProcessed.get(), clock.instant());
    }

    public long requestsReceived() {
        return requestsReceived.get();
    }

    public long errorsReported() {
        return errorsReported.get();
    }

    private WorkerMessage run(WorkerMessage request) throws JsonProcessingException {
        JsonNode payload = request.payload();
        if (payload == null || payload.isNull()) {
            throw new IllegalArgumentException("Request " + request.requestId() + " has no payload");
        }
        String name = properties.getName();
        return switch (request.role()) {
            case EVENT_ANALYZER -> {
                EventAnalysisRequest input = objectMapper.treeToValue(payload, EventAnalysisRequest.class);
                EventAnalysisOutcome output = eventAnalysisStage.analyze(input);
                eventsProcessed.addAndGet(input.events().size());
                yield request.result(name, objectMapper.valueToTree(output), output.processingTimeSeconds(),
                        output.confidence(), clock.instant());
            }
            case RISK_ASSESSOR -> {
                RiskAssessmentRequest input = objectMapper.treeToValue(payload, RiskAssessmentRequest.class);
                RiskAssessmentOutcome output = riskAssessmentStage.assess(input);
                eventsProcessed.addAndGet(input.events().size());
                yield request.result(name, objectMapper.valueToTree(output), output.processingTimeSeconds(),
                        output.confidence(), clock.instant());
            }
        };
    }

    private void deliver(WorkerMessage request, WorkerMessage reply) {
        transport.send(request.replyTo(), reply);
    }
}
