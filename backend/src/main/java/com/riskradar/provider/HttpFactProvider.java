package com.riskradar.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskradar.cache.FactProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Blocking GET against a JSON API behind a local rate limiter. Subclasses build the URL and parse the body.
 */
@Slf4j
abstract class HttpFactProvider<T> implements FactProvider<T> {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    protected HttpFactProvider(WebClient.Builder webClientBuilder, RateLimiter rateLimiter, Duration timeout) {
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
    }

    protected String get(String url) {
        long acquireStart = System.nanoTime();
        if (!rateLimiter.acquirePermission()) {
            throw new ProviderException("Local limiter timeout before " + rateLimiter.getName() + " call");
        }
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (waitedMs > 500) {
            log.info("Local {} limiter delayed {} ms", rateLimiter.getName(), waitedMs);
        }
        try {
            String body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            if (body == null || body.isBlank()) {
                throw new ProviderException(rateLimiter.getName() + " returned an empty body");
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new ProviderException(rateLimiter.getName() + " HTTP " + e.getStatusCode().value(), e);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(rateLimiter.getName() + " call failed: " + e.getMessage(), e);
        }
    }
}
