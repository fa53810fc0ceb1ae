package com.riskradar.delegation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskradar.delegation.StageDelegationClient;
import com.riskradar.delegation.WebClientWorkerMessageTransport;
import com.riskradar.delegation.WorkerMessageTransport;
import com.riskradar.delegation.health.WebClientWorkerHealthProbe;
import com.riskradar.delegation.health.WorkerHealthProbe;
import com.riskradar.delegation.health.WorkerHealthRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Delegation protocol beans: HTTP transport and health probe, the health registry and the delegation client.
 */
@Configuration
@EnableConfigurationProperties(DelegationProperties.class)
public class DelegationConfig {

    @Bean
    public WorkerMessageTransport workerMessageTransport(WebClient.Builder webClientBuilder, DelegationProperties properties) {
        return new WebClientWorkerMessageTransport(webClientBuilder, properties.getDeliveryTimeout());
    }

    @Bean
    public WorkerHealthProbe workerHealthProbe(WebClient.Builder webClientBuilder) {
        return new WebClientWorkerHealthProbe(webClientBuilder);
    }

    @Bean
    public WorkerHealthRegistry workerHealthRegistry(DelegationProperties properties, WorkerHealthProbe probe, Clock clock) {
        return new WorkerHealthRegistry(properties::addressOf, probe, properties.getHealthCheckTimeout(), clock);
    }

    @Bean
    public StageDelegationClient stageDelegationClient(WorkerHealthRegistry registry, WorkerMessageTransport transport,
                                                       ObjectMapper objectMapper, Clock clock,
                                                       DelegationProperties properties) {
        return new StageDelegationClient(registry, transport, objectMapper, clock,
                properties.getSenderName(), properties.getCallbackUrl(),
                properties.getAckTimeout(), properties.getStageTimeout());
    }
}
