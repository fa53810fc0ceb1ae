package com.riskradar.provider;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Fact provider beans, each behind its own local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {

    @Bean
    public CoinGeckoPriceProvider coinGeckoPriceProvider(ProviderProperties properties, WebClient.Builder webClientBuilder) {
        return new CoinGeckoPriceProvider(properties.getCoingecko(), webClientBuilder,
                rateLimiter("coingecko", properties.getCoingecko().getRequestsPerSecond(), properties),
                Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    @Bean
    public GoPlusReputationProvider goPlusReputationProvider(ProviderProperties properties, WebClient.Builder webClientBuilder) {
        return new GoPlusReputationProvider(properties.getGoplus(), webClientBuilder,
                rateLimiter("goplus", properties.getGoplus().getRequestsPerSecond(), properties),
                Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    @Bean
    public EtherscanHistoryProvider etherscanHistoryProvider(ProviderProperties properties, WebClient.Builder webClientBuilder) {
        return new EtherscanHistoryProvider(properties.getEtherscan(), webClientBuilder,
                rateLimiter("etherscan", properties.getEtherscan().getRequestsPerSecond(), properties),
                Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    static RateLimiter rateLimiter(String name, int requestsPerSecond, ProviderProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, requestsPerSecond))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of(name, config);
    }
}
