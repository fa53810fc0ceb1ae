package com.riskradar.risk.analyzer;

import com.riskradar.cache.FactKind;
import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.EventType;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.MalformedEventException;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskCategory;
import com.riskradar.risk.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the USD size of the moved or approved amount. Price comes from the cache (PRICE by token contract);
 * when it is unavailable the configured fallback price is used and PRICE_UNAVAILABLE is tagged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FinancialImpactAnalyzer implements FactorAnalyzer {

    static final double ZERO_ADDRESS_BUMP = 0.2;
    static final double APPROVAL_BUMP = 0.3;
    private static final double MAX_CONFIDENCE = 0.9;

    private final RiskProperties riskProperties;

    @Override
    public RiskCategory category() {
        return RiskCategory.FINANCIAL;
    }

    @Override
    public FactorResult assess(ProcessedEvent event, ScoreCache cache) {
        BigInteger rawAmount;
        try {
            Optional<BigInteger> amount = event.amount();
            if (amount.isEmpty()) {
                return FactorResult.of(0.3, 0.3, "NO_AMOUNT_DATA");
            }
            rawAmount = amount.get();
        } catch (MalformedEventException e) {
            log.debug("Malformed amount on {}: {}", event.shortHash(), e.getMessage());
            return new FactorResult(0.2, 0.5, List.of("MINIMAL_FINANCIAL_IMPACT", "MALFORMED_EVENT"),
                    Map.of("error", e.getMessage()));
        }

        RiskProperties.Financial tiers = riskProperties.getFinancial();
        int decimals = event.decimals().orElse(tiers.getDefaultTokenDecimals());
        BigDecimal tokens = new BigDecimal(rawAmount).movePointLeft(decimals);

        List<String> factors = new ArrayList<>();
        Optional<BigDecimal> price = cache.lookup(FactKind.PRICE, event.contractAddress(), BigDecimal.class);
        BigDecimal unitPrice = price.orElseGet(() -> BigDecimal.valueOf(tiers.getFallbackTokenPriceUsd()));
        double usdValue = tokens.multiply(unitPrice).doubleValue();

        Tier tier = tierFor(usdValue, tiers);
        double score = tier.score();
        double confidence = tier.confidence();
        factors.add(tier.tag());
        if (price.isEmpty()) {
            factors.add("PRICE_UNAVAILABLE");
        }

        if (event.touchesZeroAddress()) {
            score = Math.min(1.0, score + ZERO_ADDRESS_BUMP);
            confidence = Math.min(MAX_CONFIDENCE, confidence + 0.1);
            factors.add("ZERO_ADDRESS_INTERACTION");
        }
        if (event.eventType() == EventType.APPROVAL
                && tokens.compareTo(BigDecimal.valueOf(tiers.getLargeApprovalTokens())) >= 0) {
            score = Math.min(1.0, score + APPROVAL_BUMP);
            confidence = Math.min(MAX_CONFIDENCE, confidence + 0.15);
            factors.add("HIGH_VALUE_APPROVAL");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("usdValue", usdValue);
        details.put("tokenAmount", tokens.stripTrailingZeros().toPlainString());
        details.put("priceUsd", unitPrice.doubleValue());
        details.put("priceSource", price.isPresent() ? "provider" : "fallback");
        return new FactorResult(score, confidence, factors, details);
    }

    static Tier tierFor(double usdValue, RiskProperties.Financial tiers) {
        if (usdValue >= tiers.getCriticalUsd()) {
            return new Tier(1.0, 0.9, "CRITICAL_FINANCIAL_IMPACT");
        }
        if (usdValue >= tiers.getHighUsd()) {
            return new Tier(0.8, 0.8, "HIGH_FINANCIAL_IMPACT");
        }
        if (usdValue >= tiers.getMediumUsd()) {
            return new Tier(0.6, 0.7, "MEDIUM_FINANCIAL_IMPACT");
        }
        if (usdValue >= tiers.getLowUsd()) {
            return new Tier(0.4, 0.6, "LOW_FINANCIAL_IMPACT");
        }
        return new Tier(0.2, 0.5, "MINIMAL_FINANCIAL_IMPACT");
    }

    record Tier(double score, double confidence, String tag) {
    }
}
