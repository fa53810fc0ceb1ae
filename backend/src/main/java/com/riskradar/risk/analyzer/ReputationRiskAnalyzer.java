package com.riskradar.risk.analyzer;

import com.riskradar.cache.FactKind;
import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.AddressReputation;
import com.riskradar.domain.Addresses;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores the security reputation of the sender and counterparty (REPUTATION by address).
 * The score is the heaviest triggered indicator across both addresses; critical indicators score at least 0.95.
 */
@Component
public class ReputationRiskAnalyzer implements FactorAnalyzer {

    static final double CRITICAL_SCORE = 0.95;
    private static final double UNKNOWN_INDICATOR_WEIGHT = 0.3;

    private static final Map<String, Double> INDICATOR_WEIGHTS = Map.ofEntries(
            Map.entry("cybercrime", 0.9),
            Map.entry("money_laundering", 0.9),
            Map.entry("financial_crime", 0.8),
            Map.entry("sanctioned", 0.9),
            Map.entry("stealing_attack", 0.8),
            Map.entry("phishing_activities", 0.8),
            Map.entry("blackmail_activities", 0.7),
            Map.entry("darkweb_transactions", 0.7),
            Map.entry("mixer", 0.6),
            Map.entry("honeypot_related_address", 0.7),
            Map.entry("malicious_mining_activities", 0.6),
            Map.entry("blacklist_doubt", 0.8),
            Map.entry("fake_kyc", 0.5),
            Map.entry("fake_standard_interface", 0.5),
            Map.entry("fake_token", 0.4),
            Map.entry("gas_abuse", 0.4),
            Map.entry("number_of_malicious_contracts_created", 0.6),
            Map.entry("reinit", 0.3));

    static final Set<String> CRITICAL_INDICATORS = Set.of(
            "cybercrime", "money_laundering", "financial_crime", "sanctioned");

    @Override
    public RiskCategory category() {
        return RiskCategory.REPUTATION;
    }

    @Override
    public FactorResult assess(ProcessedEvent event, ScoreCache cache) {
        Set<String> addresses = new LinkedHashSet<>();
        event.sender().map(Addresses::normalize).filter(a -> !Addresses.isZero(a)).ifPresent(addresses::add);
        event.counterparty().map(Addresses::normalize).filter(a -> !Addresses.isZero(a)).ifPresent(addresses::add);

        List<AddressReputation> reputations = new ArrayList<>();
        for (String address : addresses) {
            cache.lookup(FactKind.REPUTATION, address, AddressReputation.class).ifPresent(reputations::add);
        }
        if (reputations.isEmpty()) {
            return FactorResult.of(0.3, 0.3, "REPUTATION_DATA_UNAVAILABLE");
        }

        double score = 0.0;
        Set<String> factors = new LinkedHashSet<>();
        Map<String, Object> details = new LinkedHashMap<>();
        for (AddressReputation reputation : reputations) {
            List<String> triggered = reputation.triggeredIndicators().stream().sorted().toList();
            details.put(reputation.address(), triggered);
            for (String indicator : triggered) {
                score = Math.max(score, weightOf(indicator));
                factors.add(tagFor(indicator));
            }
        }
        if (factors.isEmpty()) {
            return new FactorResult(0.0, 0.8, List.of("NO_REPUTATION_FLAGS"), details);
        }
        List<String> ordered = new ArrayList<>();
        ordered.add("REPUTATION_RISK");
        ordered.addAll(factors);
        return new FactorResult(score, 0.9, ordered, details);
    }

    static double weightOf(String indicator) {
        String key = indicator.toLowerCase(Locale.ROOT);
        if (CRITICAL_INDICATORS.contains(key)) {
            return Math.max(CRITICAL_SCORE, INDICATOR_WEIGHTS.get(key));
        }
        return INDICATOR_WEIGHTS.getOrDefault(key, UNKNOWN_INDICATOR_WEIGHT);
    }

    private static String tagFor(String indicator) {
        String key = indicator.toLowerCase(Locale.ROOT);
        String tag = key.toUpperCase(Locale.ROOT);
        return CRITICAL_INDICATORS.contains(key) ? "CRITICAL_" + tag : tag;
    }
}
