package com.riskradar.orchestration;

import com.riskradar.delegation.WorkerRole;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coordinator counters since startup.
 */
@Component
public class PipelineStatistics {

    private final AtomicLong requestsReceived = new AtomicLong();
    private final AtomicLong responsesSent = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong highRiskEvents = new AtomicLong();
    private final AtomicLong criticalEvents = new AtomicLong();
    private final Map<WorkerRole, AtomicLong> fallbacks = new EnumMap<>(WorkerRole.class);

    public PipelineStatistics() {
        for (WorkerRole role : WorkerRole.values()) {
            fallbacks.put(role, new AtomicLong());
        }
    }

    void recordReceived() {
        requestsReceived.incrementAndGet();
    }

    void recordResponded(BatchVerdict verdict) {
        responsesSent.incrementAndGet();
        eventsProcessed.addAndGet(verdict.totalEvents());
        highRiskEvents.addAndGet(verdict.highRiskCount());
        criticalEvents.addAndGet(verdict.criticalCount());
    }

    void recordError() {
        errors.incrementAndGet();
    }

    void recordFallback(WorkerRole role) {
        fallbacks.get(role).incrementAndGet();
    }

    public Snapshot snapshot() {
        Map<WorkerRole, Long> fallbackCounts = new EnumMap<>(WorkerRole.class);
        fallbacks.forEach((role, count) -> fallbackCounts.put(role, count.get()));
        return new Snapshot(requestsReceived.get(), responsesSent.get(), errors.get(), eventsProcessed.get(),
                highRiskEvents.get(), criticalEvents.get(), fallbackCounts);
    }

    public record Snapshot(
            long requestsReceived,
            long responsesSent,
            long errors,
            long eventsProcessed,
            long highRiskEvents,
            long criticalEvents,
            Map<WorkerRole, Long> fallbacks
    ) {
    }
}
