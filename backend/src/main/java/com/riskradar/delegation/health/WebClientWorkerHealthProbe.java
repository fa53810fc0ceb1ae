package com.riskradar.delegation.health;

import com.riskradar.delegation.DelegationRemoteException;
import com.riskradar.delegation.DelegationTimeoutException;
import com.riskradar.delegation.DelegationUnreachableException;
import com.riskradar.delegation.WorkerRole;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * GET {address}/api/v1/worker/health.
 */
public class WebClientWorkerHealthProbe implements WorkerHealthProbe {

    public static final String HEALTH_PATH = "/api/v1/worker/health";

    private final WebClient webClient;

    public WebClientWorkerHealthProbe(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public WorkerHealthReport probe(WorkerRole role, String address, Duration timeout) {
        String url = (address.endsWith("/") ? address.substring(0, address.length() - 1) : address) + HEALTH_PATH;
        try {
            WorkerHealthReport report = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(WorkerHealthReport.class)
                    .timeout(timeout)
                    .block();
            if (report == null) {
                throw new DelegationRemoteException(role, "EMPTY_HEALTH_REPORT", "Empty health report from " + url);
            }
            return report;
        } catch (WebClientResponseException e) {
            throw new DelegationRemoteException(role, "HTTP_" + e.getStatusCode().value(),
                    "Health check " + url + " returned " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new DelegationUnreachableException(role, "Health check " + url + " unreachable: " + e.getMessage(), e);
        } catch (DelegationRemoteException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new DelegationTimeoutException(role, "Health check " + url + " timed out after " + timeout.toMillis() + " ms", e);
            }
            throw new DelegationRemoteException(role, "HEALTH_CHECK_FAILED", "Health check " + url + " failed: " + e.getMessage(), e);
        }
    }
}
