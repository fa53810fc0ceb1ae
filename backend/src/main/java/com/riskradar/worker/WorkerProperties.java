package com.riskradar.worker;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * This node acting as a stage worker. Documented in application.yml under riskradar.worker.
 */
@ConfigurationProperties(prefix = "riskradar.worker")
@Getter
@Setter
public class WorkerProperties {

    /**
     * Accept stage requests on /api/v1/worker/messages.
     */
    private boolean enabled = true;

    /**
     * Name reported in acknowledgments, results and health reports.
     */
    private String name = "risk-radar-worker";

    /**
     * Address reported in health reports.
     */
    private String advertisedAddress = "http://localhost:8080";
}
