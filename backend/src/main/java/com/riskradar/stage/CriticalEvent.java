package com.riskradar.stage;

import com.riskradar.domain.Recommendation;

import java.util.List;

public record CriticalEvent(String transactionHash, double riskScore, Recommendation recommendation, List<String> factors) {

    public CriticalEvent {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
