package com.riskradar.domain;

import java.util.Locale;

/**
 * Risk dimensions scored by the factor analyzers. Declaration order breaks ties when two
 * categories share the highest score.
 */
public enum RiskCategory {
    FINANCIAL,
    REPUTATION,
    BEHAVIORAL,
    HISTORICAL,
    APPROVAL;

    /** Lowercase key used in factor tags and configuration. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
