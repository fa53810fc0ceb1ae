package com.riskradar.cache;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Score cache settings. Documented in application.yml under riskradar.cache.
 */
@ConfigurationProperties(prefix = "riskradar.cache")
@Getter
@Setter
public class ScoreCacheProperties {

    /**
     * Time-to-live of a cached fact in seconds, measured from insertion.
     */
    private long ttlSeconds = 300;

    /**
     * Upper bound on cached facts across all kinds.
     */
    private long maximumSize = 10_000;
}
