package com.riskradar.delegation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Envelope exchanged between the coordinator and stage workers.
 *
 * @param replyTo               base URL the worker posts acknowledgment and result to (requests only)
 * @param payload               stage input for REQUEST, stage output for RESULT
 * @param message               acknowledgment text or error message
 * @param processingTimeSeconds worker-side processing time (RESULT only)
 * @param confidence            stage confidence (RESULT only)
 * @param errorType             error classification (ERROR only)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(
        MessageType type,
        String requestId,
        WorkerRole role,
        String sender,
        String replyTo,
        String priority,
        JsonNode payload,
        String message,
        Double processingTimeSeconds,
        Double confidence,
        String errorType,
        Instant timestamp
) {

    public static WorkerMessage request(String requestId, WorkerRole role, String sender, String replyTo,
                                        String priority, JsonNode payload, Instant timestamp) {
        return new WorkerMessage(MessageType.REQUEST, requestId, role, sender, replyTo, priority, payload,
                null, null, null, null, timestamp);
    }

    public WorkerMessage acknowledge(String workerName, String text, Instant at) {
        return new WorkerMessage(MessageType.ACKNOWLEDGMENT, requestId, role, workerName, null, priority, null,
                text, null, null, null, at);
    }

    public WorkerMessage result(String workerName, JsonNode output, double processingTime, double stageConfidence,
                                Instant at) {
        return new WorkerMessage(MessageType.RESULT, requestId, role, workerName, null, priority, output,
                null, processingTime, stageConfidence, null, at);
    }

    public WorkerMessage error(String workerName, String type, String errorMessage, Instant at) {
        return new WorkerMessage(MessageType.ERROR, requestId, role, workerName, null, priority, null,
                errorMessage, null, null, type, at);
    }
}
