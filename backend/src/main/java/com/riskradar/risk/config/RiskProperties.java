package com.riskradar.risk.config;

import com.riskradar.domain.RiskCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk engine thresholds, factor weights and financial tiers. Documented in application.yml under riskradar.risk.
 */
@ConfigurationProperties(prefix = "riskradar.risk")
@Getter
@Setter
public class RiskProperties {

    private static final double WEIGHT_SUM_TOLERANCE = 0.01;

    /**
     * Below this mean confidence the recommendation is MONITOR regardless of score.
     */
    private double minConfidence = 0.6;

    /**
     * Score from which an event counts as high risk (IMMEDIATE_INVESTIGATION).
     */
    private double highRiskThreshold = 0.7;

    /**
     * Score from which an event counts as critical (CRITICAL_INVESTIGATION).
     */
    private double criticalRiskThreshold = 0.9;

    /**
     * Score from which INVESTIGATE is recommended.
     */
    private double investigateThreshold = 0.5;

    private Weights weights = new Weights();

    private Financial financial = new Financial();

    /**
     * Weight of a category in the combined score.
     */
    public double weightOf(RiskCategory category) {
        return switch (category) {
            case FINANCIAL -> weights.getFinancial();
            case BEHAVIORAL -> weights.getBehavioral();
            case REPUTATION -> weights.getReputation();
            case HISTORICAL -> weights.getHistorical();
            case APPROVAL -> weights.getApproval();
        };
    }

    /**
     * Configuration errors; empty when the settings are consistent.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        double sum = 0.0;
        for (RiskCategory category : RiskCategory.values()) {
            double w = weightOf(category);
            if (w < 0.0 || !Double.isFinite(w)) {
                errors.add("Weight for " + category.key() + " must be a non-negative number, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            errors.add("Risk weights must sum to 1.0, got " + sum);
        }
        if (!(0.0 <= minConfidence && minConfidence <= 1.0)) {
            errors.add("minConfidence must be within [0,1], got " + minConfidence);
        }
        if (!(0.0 < investigateThreshold
                && investigateThreshold < highRiskThreshold
                && highRiskThreshold < criticalRiskThreshold
                && criticalRiskThreshold <= 1.0)) {
            errors.add("Thresholds must satisfy 0 < investigate < high < critical <= 1, got "
                    + investigateThreshold + ", " + highRiskThreshold + ", " + criticalRiskThreshold);
        }
        if (!(financial.getLowUsd() < financial.getMediumUsd()
                && financial.getMediumUsd() < financial.getHighUsd()
                && financial.getHighUsd() < financial.getCriticalUsd())) {
            errors.add("Financial tiers must be strictly increasing (low < medium < high < critical)");
        }
        if (financial.getFallbackTokenPriceUsd() <= 0.0) {
            errors.add("fallbackTokenPriceUsd must be positive");
        }
        return errors;
    }

    /**
     * Category weights; must sum to 1.0. Scores are normalized by the weights of the analyzers that ran.
     */
    @Getter
    @Setter
    public static class Weights {
        private double financial = 0.35;
        private double behavioral = 0.25;
        private double reputation = 0.20;
        private double historical = 0.15;
        private double approval = 0.05;
    }

    @Getter
    @Setter
    public static class Financial {
        /** USD value from which impact is critical (score 1.0). */
        private double criticalUsd = 1_000_000;
        /** USD value from which impact is high (score 0.8). */
        private double highUsd = 100_000;
        /** USD value from which impact is medium (score 0.6). */
        private double mediumUsd = 10_000;
        /** USD value from which impact is low (score 0.4). */
        private double lowUsd = 1_000;
        /** Decimals assumed when the event does not carry them. */
        private int defaultTokenDecimals = 18;
        /** USD price used when no price is available for the token. */
        private double fallbackTokenPriceUsd = 1.0;
        /** Whole-token approval amount from which the approval bump applies. */
        private long largeApprovalTokens = 1_000;
    }
}
