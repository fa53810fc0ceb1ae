package com.riskradar.delegation.config;

import com.riskradar.delegation.WorkerRole;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Remote stage workers and delegation timeouts. Documented in application.yml under riskradar.delegation.
 */
@ConfigurationProperties(prefix = "riskradar.delegation")
@Getter
@Setter
public class DelegationProperties {

    /**
     * Base URL of the event analysis worker; blank means the stage always runs locally.
     */
    private String eventAnalyzerAddress = "";

    /**
     * Base URL of the risk assessment worker; blank means the stage always runs locally.
     */
    private String riskAssessorAddress = "";

    /**
     * Base URL workers post acknowledgments and results to (this node).
     */
    private String callbackUrl = "http://localhost:8080";

    /**
     * Sender name put on outgoing requests.
     */
    private String senderName = "risk-radar-orchestrator";

    /**
     * Bound on a single worker health probe.
     */
    private Duration healthCheckTimeout = Duration.ofSeconds(5);

    /**
     * Grace window for the worker's acknowledgment after a request is delivered.
     */
    private Duration ackTimeout = Duration.ofSeconds(2);

    /**
     * Overall bound on one stage delegation, acknowledgment included.
     */
    private Duration stageTimeout = Duration.ofSeconds(30);

    /**
     * Bound on delivering one message over HTTP.
     */
    private Duration deliveryTimeout = Duration.ofSeconds(5);

    /**
     * Interval of the scheduled worker health check in milliseconds.
     */
    private long healthCheckIntervalMs = 30_000;

    public String addressOf(WorkerRole role) {
        return switch (role) {
            case EVENT_ANALYZER -> eventAnalyzerAddress;
            case RISK_ASSESSOR -> riskAssessorAddress;
        };
    }
}
