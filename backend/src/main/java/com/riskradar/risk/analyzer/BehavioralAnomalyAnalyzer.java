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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the event against the sender's recent behavior (HISTORY by sender address):
 * value relative to the historical average, first contact with the contract, account age and activity level.
 * Contributions are summed and capped at 1.0. Confidence scales with how much history backs the score.
 */
@Component
@RequiredArgsConstructor
public class BehavioralAnomalyAnalyzer implements FactorAnalyzer {

    /** One token with 18 decimals. */
    private static final BigInteger ONE_ETHER = BigInteger.TEN.pow(18);
    private static final BigInteger TEN_ETHER = BigInteger.TEN.pow(19);

    private final Clock clock;

    @Override
    public RiskCategory category() {
        return RiskCategory.BEHAVIORAL;
    }

    @Override
    public FactorResult assess(ProcessedEvent event, ScoreCache cache) {
        Optional<String> sender = event.sender();
        if (sender.isEmpty()) {
            return FactorResult.of(0.3, 0.3, "NO_FROM_ADDRESS");
        }
        AddressHistory history = cache.lookup(FactKind.HISTORY, sender.get(), AddressHistory.class)
                .orElseGet(AddressHistory::empty);
        BigInteger value = currentValue(event);
        double ratio = valueRatio(value, history.averageValue());

        List<String> anomalies = new ArrayList<>();
        double score = 0.0;

        if (ratio > 1000) {
            score += 0.9;
        } else if (ratio > 100) {
            score += 0.7;
        } else if (ratio > 10) {
            score += 0.5;
        } else if (ratio > 2) {
            score += 0.2;
        }
        if (ratio > 10) {
            anomalies.add("UNUSUAL_VALUE");
        }

        String contract = event.contractAddress();
        if (contract != null && !contract.isBlank() && !history.hasInteractedWith(contract)) {
            if (!history.seenContracts().isEmpty()) {
                score += 0.3;
                anomalies.add("NEW_CONTRACT_INTERACTION");
            } else {
                score += 0.1;
            }
        }

        if (history.frequencyPerDay() > 10 && ratio > 10) {
            score += 0.2;
        }

        Optional<Duration> age = history.accountAge(clock.instant());
        if (age.isPresent()) {
            if (age.get().compareTo(Duration.ofDays(1)) < 0) {
                if (value.compareTo(ONE_ETHER) > 0) {
                    score += 0.4;
                    anomalies.add("NEW_ACCOUNT_LARGE_VALUE");
                }
            } else if (age.get().compareTo(Duration.ofDays(7)) < 0 && value.compareTo(TEN_ETHER) > 0) {
                score += 0.3;
                anomalies.add("NEW_ACCOUNT_LARGE_VALUE");
            }
        }

        if (history.transactionCount() == 0) {
            if (value.compareTo(ONE_ETHER) > 0) {
                score += 0.5;
                anomalies.add("FIRST_TRANSACTION_LARGE_VALUE");
            }
        } else if (history.transactionCount() < 5 && ratio > 50) {
            score += 0.3;
        }

        score = Math.min(score, 1.0);
        double confidence = score * 0.8 * dataQuality(history.transactionCount());

        List<String> factors = new ArrayList<>();
        factors.add(levelTag(score));
        factors.addAll(anomalies);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("valueRatio", ratio);
        details.put("historicalTransactions", history.transactionCount());
        details.put("frequencyPerDay", history.frequencyPerDay());
        return new FactorResult(score, confidence, factors, details);
    }

    static double dataQuality(int historicalPoints) {
        if (historicalPoints > 50) {
            return 1.0;
        }
        if (historicalPoints > 10) {
            return 0.7;
        }
        if (historicalPoints > 0) {
            return 0.4;
        }
        return 0.1;
    }

    private static String levelTag(double score) {
        if (score > 0.7) {
            return "HIGH_ANOMALY_SCORE";
        }
        if (score > 0.4) {
            return "MEDIUM_ANOMALY_SCORE";
        }
        return "LOW_ANOMALY_SCORE";
    }

    private static BigInteger currentValue(ProcessedEvent event) {
        try {
            return event.amount().orElse(BigInteger.ZERO);
        } catch (MalformedEventException e) {
            return BigInteger.ZERO;
        }
    }

    private static double valueRatio(BigInteger value, BigInteger average) {
        if (average.signum() <= 0) {
            return 0.0;
        }
        return new BigDecimal(value).divide(new BigDecimal(average), MathContext.DECIMAL64).doubleValue();
    }
}
