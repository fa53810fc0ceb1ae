package com.riskradar.delegation;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delegation outcome counters per worker role, plus late or unmatched inbound messages.
 */
public class DelegationStatistics {

    private final Map<WorkerRole, Map<DelegationStatus, AtomicLong>> outcomes = new ConcurrentHashMap<>();
    private final AtomicLong droppedMessages = new AtomicLong();

    public DelegationStatistics() {
        for (WorkerRole role : WorkerRole.values()) {
            Map<DelegationStatus, AtomicLong> counters = new EnumMap<>(DelegationStatus.class);
            for (DelegationStatus status : DelegationStatus.values()) {
                counters.put(status, new AtomicLong());
            }
            outcomes.put(role, counters);
        }
    }

    void record(WorkerRole role, DelegationStatus status) {
        outcomes.get(role).get(status).incrementAndGet();
    }

    void recordDropped() {
        droppedMessages.incrementAndGet();
    }

    public long count(WorkerRole role, DelegationStatus status) {
        return outcomes.get(role).get(status).get();
    }

    public long droppedMessages() {
        return droppedMessages.get();
    }

    public Map<WorkerRole, Map<DelegationStatus, Long>> snapshot() {
        Map<WorkerRole, Map<DelegationStatus, Long>> copy = new EnumMap<>(WorkerRole.class);
        outcomes.forEach((role, counters) -> {
            Map<DelegationStatus, Long> values = new EnumMap<>(DelegationStatus.class);
            counters.forEach((status, counter) -> values.put(status, counter.get()));
            copy.put(role, values);
        });
        return copy;
    }
}
