package com.riskradar.risk.analyzer;

import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskCategory;

/**
 * One risk dimension. Implementations return a degraded result (low score, low confidence, explanatory tag)
 * when data is missing instead of throwing; the engine isolates any exception that escapes anyway.
 */
public interface FactorAnalyzer {

    RiskCategory category();

    /** Whether this analyzer contributes to the given event's score. */
    default boolean appliesTo(ProcessedEvent event) {
        return true;
    }

    FactorResult assess(ProcessedEvent event, ScoreCache cache);
}
