package com.riskradar.risk.analyzer;

import com.riskradar.cache.FactKind;
import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.AddressHistory;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.MalformedEventException;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Account age and activity volume heuristics for the sender, independent of the current event's shape.
 */
@Component
@RequiredArgsConstructor
public class HistoricalContextAnalyzer implements FactorAnalyzer {

    private final Clock clock;

    @Override
    public RiskCategory category() {
        return RiskCategory.HISTORICAL;
    }

    @Override
    public FactorResult assess(ProcessedEvent event, ScoreCache cache) {
        Optional<String> sender = event.sender();
        if (sender.isEmpty()) {
            return FactorResult.of(0.3, 0.3, "NO_FROM_ADDRESS");
        }
        AddressHistory history = cache.lookup(FactKind.HISTORY, sender.get(), AddressHistory.class)
                .orElseGet(AddressHistory::empty);

        List<String> factors = new ArrayList<>();
        double score = 0.0;

        Optional<Duration> age = history.accountAge(clock.instant());
        if (age.isPresent()) {
            Duration d = age.get();
            if (d.compareTo(Duration.ofDays(1)) < 0) {
                score += 0.3;
                factors.add("NEW_ACCOUNT");
            } else if (d.compareTo(Duration.ofDays(7)) < 0) {
                score += 0.2;
                factors.add("VERY_NEW_ACCOUNT");
            } else if (d.compareTo(Duration.ofDays(30)) < 0) {
                score += 0.1;
                factors.add("RECENT_ACCOUNT");
            }
        }

        int count = history.transactionCount();
        if (count == 0) {
            score += 0.4;
            factors.add("NO_TRANSACTION_HISTORY");
        } else if (count < 5) {
            score += 0.2;
            factors.add("MINIMAL_TRANSACTION_HISTORY");
        } else if (count > 1000) {
            score += 0.1;
            factors.add("HIGH_FREQUENCY_USER");
        }

        int counterparties = history.seenContracts().size();
        if (counterparties == 0) {
            score += 0.2;
            factors.add("NO_CONTRACT_INTERACTIONS");
        } else if (counterparties > 100) {
            score += 0.1;
            factors.add("MANY_CONTRACT_INTERACTIONS");
        }

        BigInteger total = history.totalValue();
        if (total.signum() > 0 && currentValue(event).shiftLeft(1).compareTo(total) > 0) {
            score += 0.3;
            factors.add("LARGE_VALUE_RATIO");
        }

        if (history.frequencyPerDay() > 50) {
            score += 0.1;
            factors.add("VERY_HIGH_FREQUENCY");
        } else if (history.frequencyPerDay() == 0.0 && count > 0) {
            score += 0.2;
            factors.add("INACTIVE_ACCOUNT");
        }

        if (factors.isEmpty()) {
            factors.add("STANDARD_HISTORICAL_CONTEXT");
        }
        double confidence = count > 10 ? 0.8 : count > 0 ? 0.6 : 0.4;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transactionCount", count);
        details.put("uniqueContracts", counterparties);
        age.ifPresent(d -> details.put("accountAgeDays", d.toHours() / 24.0));
        return new FactorResult(Math.min(score, 1.0), confidence, factors, details);
    }

    private static BigInteger currentValue(ProcessedEvent event) {
        try {
            return event.amount().orElse(BigInteger.ZERO);
        } catch (MalformedEventException e) {
            return BigInteger.ZERO;
        }
    }
}
