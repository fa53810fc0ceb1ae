package com.riskradar.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined verdict for one event, keyed like the event by transaction hash and log index.
 *
 * @param components per-category analyzer output, in evaluation order
 * @param assessedAt instant taken from the engine clock
 */
public record RiskAssessment(
        String transactionHash,
        int logIndex,
        double overallScore,
        double overallConfidence,
        RiskCategory primaryCategory,
        List<String> factors,
        Recommendation recommendation,
        Map<RiskCategory, FactorResult> components,
        Instant assessedAt
) {

    public RiskAssessment {
        factors = factors == null ? List.of() : List.copyOf(factors);
        components = components == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }
}
