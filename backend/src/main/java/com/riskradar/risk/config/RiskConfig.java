package com.riskradar.risk.config;

import com.riskradar.cache.ScoreCache;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.risk.analyzer.FactorAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Risk module wiring. Startup fails when the configured weights or thresholds are inconsistent.
 */
@Configuration
@EnableConfigurationProperties(RiskProperties.class)
@Slf4j
public class RiskConfig {

    @Bean
    public RiskAssessmentEngine riskAssessmentEngine(List<FactorAnalyzer> analyzers, ScoreCache scoreCache,
                                                     RiskProperties riskProperties, Clock clock) {
        List<String> errors = riskProperties.validate();
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid riskradar.risk configuration: " + String.join("; ", errors));
        }
        RiskAssessmentEngine engine = new RiskAssessmentEngine(analyzers, scoreCache, riskProperties, clock);
        log.info("Risk engine initialized with analyzers {}", engine.categories());
        return engine;
    }
}
