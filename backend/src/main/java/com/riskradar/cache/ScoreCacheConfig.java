package com.riskradar.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@EnableConfigurationProperties(ScoreCacheProperties.class)
public class ScoreCacheConfig {

    @Bean
    public ScoreCache scoreCache(ScoreCacheProperties properties, List<FactProvider<?>> factProviders, Clock clock) {
        return new ScoreCache(
                Duration.ofSeconds(Math.max(1, properties.getTtlSeconds())),
                Math.max(1, properties.getMaximumSize()),
                Ticker.systemTicker(),
                clock,
                factProviders);
    }
}
