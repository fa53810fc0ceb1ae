package com.riskradar.delegation;

/**
 * Delivers protocol messages: requests to a worker, acknowledgments/results/errors back to the coordinator.
 */
public interface WorkerMessageTransport {

    String WORKER_MESSAGES_PATH = "/api/v1/worker/messages";
    String DELEGATION_MESSAGES_PATH = "/api/v1/delegation/messages";

    /**
     * Hands the message to the node at {@code targetAddress}. Returns once delivery is accepted;
     * the stage's answer arrives separately.
     *
     * @throws DelegationUnreachableException when the target cannot be reached or refuses the message
     */
    void send(String targetAddress, WorkerMessage message);
}
