package com.riskradar.delegation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskradar.delegation.health.WorkerHealth;
import com.riskradar.delegation.health.WorkerHealthRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs one logical call to a remote stage worker: pre-flight health read, send, wait for the acknowledgment
 * within the grace window, then wait for the typed result until the overall timeout.
 * <p>
 * Replies arrive through {@link #receive} (the inbound delegation endpoint) and are matched by request id.
 * Replies for unknown or finished requests are dropped. Nothing is retried: a failed call reports its status
 * and the caller decides on fallback.
 */
@Slf4j
public class StageDelegationClient {

    private final WorkerHealthRegistry healthRegistry;
    private final WorkerMessageTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String senderName;
    private final String callbackUrl;
    private final Duration ackTimeout;
    private final Duration defaultTimeout;
    private final DelegationStatistics statistics = new DelegationStatistics();
    private final Map<String, PendingDelegation> pending = new ConcurrentHashMap<>();

    public StageDelegationClient(WorkerHealthRegistry healthRegistry, WorkerMessageTransport transport,
                                 ObjectMapper objectMapper, Clock clock, String senderName, String callbackUrl,
                                 Duration ackTimeout, Duration defaultTimeout) {
        this.healthRegistry = healthRegistry;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.senderName = senderName;
        this.callbackUrl = callbackUrl;
        this.ackTimeout = ackTimeout;
        this.defaultTimeout = defaultTimeout;
    }

    public <R> DelegationOutcome<R> delegate(WorkerRole role, String requestId, String priority, Object payload,
                                             Class<R> resultType) {
        return delegate(role, requestId, priority, payload, resultType, defaultTimeout);
    }

    /**
     * @param timeout overall bound, acknowledgment wait included
     */
    public <R> DelegationOutcome<R> delegate(WorkerRole role, String requestId, String priority, Object payload,
                                             Class<R> resultType, Duration timeout) {
        if (!healthRegistry.isHealthy(role)) {
            WorkerHealth health = healthRegistry.healthOf(role);
            String reason = "Worker " + role.key() + " is " + (health != null ? health.status() : "unknown");
            log.warn("Skipping delegation {}: {}", requestId, reason);
            return finish(role, DelegationOutcome.failed(DelegationStatus.UNHEALTHY, reason));
        }
        String address = healthRegistry.addressOf(role).orElse(null);
        if (address == null) {
            return finish(role, DelegationOutcome.failed(DelegationStatus.UNHEALTHY, "No address for " + role.key()));
        }

        PendingDelegation call = new PendingDelegation(role);
        if (pending.putIfAbsent(requestId, call) != null) {
            throw new IllegalArgumentException("Delegation already in flight for request " + requestId);
        }
        try {
            JsonNode body = objectMapper.valueToTree(payload);
            transport.send(address, WorkerMessage.request(requestId, role, senderName, callbackUrl, priority, body,
                    clock.instant()));
            WorkerMessage reply = await(call, requestId, timeout);
            if (reply.type() == MessageType.ERROR) {
                throw new DelegationRemoteException(role, reply.errorType(),
                        "Worker " + role.key() + " reported " + reply.errorType() + ": " + reply.message());
            }
            R result = decode(role, reply, resultType);
            log.info("Delegation {} to {} succeeded", requestId, role.key());
            return finish(role, DelegationOutcome.success(result));
        } catch (DelegationTimeoutException e) {
            log.warn("Delegation {} to {} timed out: {}", requestId, role.key(), e.getMessage());
            return finish(role, DelegationOutcome.failed(DelegationStatus.TIMEOUT, e.getMessage()));
        } catch (DelegationException e) {
            log.warn("Delegation {} to {} failed: {}", requestId, role.key(), e.getMessage());
            return finish(role, DelegationOutcome.failed(DelegationStatus.ERROR, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(role, DelegationOutcome.failed(DelegationStatus.ERROR, "Interrupted while waiting for " + role.key()));
        } finally {
            pending.remove(requestId);
        }
    }

    /**
     * Routes an inbound acknowledgment, result or error to its waiting call.
     *
     * @return false when no call is waiting for the request id
     */
    public boolean receive(WorkerMessage message) {
        if (message == null || message.requestId() == null) {
            statistics.recordDropped();
            return false;
        }
        PendingDelegation call = pending.get(message.requestId());
        if (call == null) {
            statistics.recordDropped();
            log.debug("Dropping {} for unknown or finished request {}", message.type(), message.requestId());
            return false;
        }
        switch (message.type()) {
            case ACKNOWLEDGMENT -> call.acknowledged.complete(message);
            case RESULT, ERROR -> {
                call.acknowledged.complete(message);
                call.completed.complete(message);
            }
            default -> {
                statistics.recordDropped();
                log.warn("Unexpected {} message for request {}", message.type(), message.requestId());
                return false;
            }
        }
        return true;
    }

    public int inFlight() {
        return pending.size();
    }

    public DelegationStatistics statistics() {
        return statistics;
    }

    private WorkerMessage await(PendingDelegation call, String requestId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Duration ackWindow = ackTimeout.compareTo(timeout) < 0 ? ackTimeout : timeout;
        try {
            call.acknowledged.get(ackWindow.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new DelegationTimeoutException(call.role,
                    "No acknowledgment for " + requestId + " within " + ackWindow.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new DelegationException(call.role, "Acknowledgment wait failed for " + requestId, e.getCause());
        }
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return call.completed.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new DelegationTimeoutException(call.role,
                    "No result for " + requestId + " within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new DelegationException(call.role, "Result wait failed for " + requestId, e.getCause());
        }
    }

    private <R> R decode(WorkerRole role, WorkerMessage reply, Class<R> resultType) {
        if (reply.payload() == null || reply.payload().isNull()) {
            throw new DelegationRemoteException(role, "EMPTY_RESULT", "Worker " + role.key() + " returned no payload");
        }
        try {
            return objectMapper.treeToValue(reply.payload(), resultType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DelegationRemoteException(role, "UNREADABLE_RESULT",
                    "Worker " + role.key() + " returned an unreadable " + resultType.getSimpleName(), e);
        }
    }

    private <R> DelegationOutcome<R> finish(WorkerRole role, DelegationOutcome<R> outcome) {
        statistics.record(role, outcome.status());
        return outcome;
    }

    private static final class PendingDelegation {
        private final WorkerRole role;
        private final CompletableFuture<WorkerMessage> acknowledged = new CompletableFuture<>();
        private final CompletableFuture<WorkerMessage> completed = new CompletableFuture<>();

        private PendingDelegation(WorkerRole role) {
            this.role = role;
        }
    }
}
