package com.riskradar.delegation.job;

import com.riskradar.delegation.health.WorkerHealthRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps worker health fresh so delegation can decide from a pure read: once when the application is ready,
 * then on a fixed rate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerHealthCheckJob {

    private final WorkerHealthRegistry workerHealthRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void checkOnStartup() {
        log.info("Initial worker health check");
        workerHealthRegistry.checkAll();
    }

    @Scheduled(
            fixedRateString = "${riskradar.delegation.health-check-interval-ms:30000}",
            initialDelayString = "${riskradar.delegation.health-check-interval-ms:30000}")
    public void runScheduled() {
        workerHealthRegistry.checkAll();
    }
}
