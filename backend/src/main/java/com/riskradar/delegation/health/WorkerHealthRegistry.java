package com.riskradar.delegation.health;

import com.riskradar.delegation.DelegationException;
import com.riskradar.delegation.DelegationTimeoutException;
import com.riskradar.delegation.DelegationUnreachableException;
import com.riskradar.delegation.WorkerRole;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Liveness and address of each stage worker. {@link #checkHealth} is the only writer and runs under this
 * registry's lock; {@link #isHealthy} and the other reads never block and never touch the network.
 */
@Slf4j
public class WorkerHealthRegistry {

    private final Map<WorkerRole, WorkerHealth> health = new ConcurrentHashMap<>();
    private final Map<WorkerRole, String> addresses = new ConcurrentHashMap<>();
    private final WorkerHealthProbe probe;
    private final Duration probeTimeout;
    private final Clock clock;

    public WorkerHealthRegistry(Function<WorkerRole, String> configuredAddresses, WorkerHealthProbe probe,
                                Duration probeTimeout, Clock clock) {
        this.probe = probe;
        this.probeTimeout = probeTimeout;
        this.clock = clock;
        for (WorkerRole role : WorkerRole.values()) {
            String address = configuredAddresses.apply(role);
            if (address != null && !address.isBlank()) {
                addresses.put(role, address.strip());
            }
            health.put(role, initial(role));
        }
    }

    /**
     * Probes the worker and records the outcome. A probe timeout counts as UNHEALTHY, a connection failure as
     * UNREACHABLE, a missing address as NOT_FOUND.
     */
    public synchronized WorkerHealth checkHealth(WorkerRole role) {
        String address = addresses.get(role);
        Instant now = clock.instant();
        WorkerHealth previous = health.get(role);
        WorkerHealth updated;
        if (address == null) {
            updated = new WorkerHealth(role, null, WorkerStatus.NOT_FOUND, null, 0, 0.0, now, "No address configured");
        } else {
            updated = probe(role, address, previous, now);
        }
        health.put(role, updated);
        if (previous == null || previous.status() != updated.status()) {
            if (updated.isHealthy()) {
                log.info("Worker {} at {} is {}", role.key(), address, updated.status());
            } else {
                log.warn("Worker {} at {} is {}: {}", role.key(), address, updated.status(), updated.detail());
            }
        }
        return updated;
    }

    public void checkAll() {
        for (WorkerRole role : WorkerRole.values()) {
            checkHealth(role);
        }
    }

    public boolean isHealthy(WorkerRole role) {
        WorkerHealth h = health.get(role);
        return h != null && h.isHealthy();
    }

    public WorkerHealth healthOf(WorkerRole role) {
        return health.get(role);
    }

    public Optional<String> addressOf(WorkerRole role) {
        return Optional.ofNullable(addresses.get(role));
    }

    /**
     * Points a role at a new address. Status resets to UNKNOWN until the next check.
     */
    public synchronized void register(WorkerRole role, String address) {
        if (address == null || address.isBlank()) {
            addresses.remove(role);
        } else {
            addresses.put(role, address.strip());
        }
        health.put(role, initial(role));
    }

    public Map<WorkerRole, WorkerHealth> snapshot() {
        Map<WorkerRole, WorkerHealth> copy = new EnumMap<>(WorkerRole.class);
        copy.putAll(health);
        return copy;
    }

    private WorkerHealth probe(WorkerRole role, String address, WorkerHealth previous, Instant now) {
        Instant lastHeartbeat = previous != null ? previous.lastHeartbeat() : null;
        try {
            WorkerHealthReport report = probe.probe(role, address, probeTimeout);
            WorkerStatus status = report.isHealthy() ? WorkerStatus.HEALTHY : WorkerStatus.UNHEALTHY;
            return new WorkerHealth(role, address, status, now, report.eventsProcessed(), report.uptimeSeconds(),
                    now, "Reported status " + report.status());
        } catch (DelegationTimeoutException e) {
            return new WorkerHealth(role, address, WorkerStatus.UNHEALTHY, lastHeartbeat, 0, 0.0, now, e.getMessage());
        } catch (DelegationUnreachableException e) {
            return new WorkerHealth(role, address, WorkerStatus.UNREACHABLE, lastHeartbeat, 0, 0.0, now, e.getMessage());
        } catch (DelegationException e) {
            return new WorkerHealth(role, address, WorkerStatus.UNHEALTHY, lastHeartbeat, 0, 0.0, now, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Health probe for {} failed unexpectedly", role.key(), e);
            return new WorkerHealth(role, address, WorkerStatus.UNHEALTHY, lastHeartbeat, 0, 0.0, now, e.getMessage());
        }
    }

    private WorkerHealth initial(WorkerRole role) {
        String address = addresses.get(role);
        WorkerStatus status = address == null ? WorkerStatus.NOT_FOUND : WorkerStatus.UNKNOWN;
        return new WorkerHealth(role, address, status, null, 0, 0.0, null, null);
    }
}
