package com.riskradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one factor analyzer: score and confidence in [0,1], ordered tags and optional details.
 */
public record FactorResult(double score, double confidence, List<String> factors, Map<String, Object> details) {

    public FactorResult {
        factors = factors == null ? List.of() : List.copyOf(factors);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static FactorResult of(double score, double confidence, List<String> factors) {
        return new FactorResult(score, confidence, factors, Map.of());
    }

    public static FactorResult of(double score, double confidence, String... factors) {
        return new FactorResult(score, confidence, List.of(factors), Map.of());
    }
}
