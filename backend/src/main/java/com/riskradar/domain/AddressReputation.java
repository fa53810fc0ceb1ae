package com.riskradar.domain;

import java.util.Set;

/**
 * Security indicators reported for an address. Indicator names follow the reputation source
 * (e.g. "cybercrime", "phishing_activities").
 */
public record AddressReputation(String address, Set<String> triggeredIndicators) {

    public AddressReputation {
        triggeredIndicators = triggeredIndicators == null ? Set.of() : Set.copyOf(triggeredIndicators);
    }

    public boolean isClean() {
        return triggeredIndicators.isEmpty();
    }
}
