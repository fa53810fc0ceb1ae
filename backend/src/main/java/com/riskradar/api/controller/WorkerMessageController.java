package com.riskradar.api.controller;

import com.riskradar.api.dto.ErrorBody;
import com.riskradar.delegation.MessageType;
import com.riskradar.delegation.WorkerMessage;
import com.riskradar.worker.StageWorkerService;
import com.riskradar.worker.WorkerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Worker side of the stage protocol: POST /worker/messages accepts a REQUEST and processes it asynchronously;
 * acknowledgment and result go to the request's replyTo. 503 when this node does not act as a worker.
 */
@RestController
@RequestMapping("/api/v1/worker")
@RequiredArgsConstructor
public class WorkerMessageController {

    private final StageWorkerService workerService;
    private final WorkerProperties workerProperties;

    @PostMapping("/messages")
    public ResponseEntity<?> receive(@RequestBody WorkerMessage message) {
        if (!workerProperties.isEnabled()) {
            return workerDisabled();
        }
        if (message.type() != MessageType.REQUEST || message.requestId() == null
                || message.role() == null || message.replyTo() == null) {
            return ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_MESSAGE", "Expected a REQUEST with requestId, role and replyTo"));
        }
        workerService.handleAsync(message);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        if (!workerProperties.isEnabled()) {
            return workerDisabled();
        }
        return ResponseEntity.ok(workerService.healthReport());
    }

    private static ResponseEntity<ErrorBody> workerDisabled() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("WORKER_DISABLED", "This node does not serve stage requests"));
    }
}
