package com.riskradar.api.controller;

import com.riskradar.api.dto.ErrorBody;
import com.riskradar.delegation.StageDelegationClient;
import com.riskradar.delegation.WorkerMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /delegation/messages: acknowledgments, results and errors from stage workers.
 * Replies for requests no longer pending (timed out or unknown) get 404 and are dropped.
 */
@RestController
@RequestMapping("/api/v1/delegation")
@RequiredArgsConstructor
public class DelegationCallbackController {

    private final StageDelegationClient delegationClient;

    @PostMapping("/messages")
    public ResponseEntity<?> receive(@RequestBody WorkerMessage message) {
        if (delegationClient.receive(message)) {
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("UNKNOWN_REQUEST", "No pending delegation for " + message.requestId()));
    }
}
