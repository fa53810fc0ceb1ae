package com.riskradar.delegation;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP transport: POSTs requests to {@value #WORKER_MESSAGES_PATH} and replies to {@value #DELEGATION_MESSAGES_PATH}.
 */
public class WebClientWorkerMessageTransport implements WorkerMessageTransport {

    private final WebClient webClient;
    private final Duration deliveryTimeout;

    public WebClientWorkerMessageTransport(WebClient.Builder builder, Duration deliveryTimeout) {
        this.webClient = builder.build();
        this.deliveryTimeout = deliveryTimeout;
    }

    @Override
    public void send(String targetAddress, WorkerMessage message) {
        String path = message.type() == MessageType.REQUEST ? WORKER_MESSAGES_PATH : DELEGATION_MESSAGES_PATH;
        String url = stripTrailingSlash(targetAddress) + path;
        try {
            webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(message)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(deliveryTimeout)
                    .block();
        } catch (RuntimeException e) {
            throw new DelegationUnreachableException(message.role(),
                    "Delivery of " + message.type() + " " + message.requestId() + " to " + url + " failed: " + e.getMessage(), e);
        }
    }

    static String stripTrailingSlash(String address) {
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }
}
