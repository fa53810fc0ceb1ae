package com.riskradar.stage;

import com.riskradar.domain.EventType;
import com.riskradar.domain.MalformedEventException;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.SuspicionLevel;
import com.riskradar.risk.analyzer.ApprovalRiskAnalyzer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rule-based patterns over a single analyzed event.
 */
public final class PatternDetector {

    public static final String LARGE_TRANSFER = "large_transfer";
    public static final String UNLIMITED_APPROVAL = "unlimited_approval";
    public static final String ZERO_ADDRESS_INTERACTION = "zero_address_interaction";
    public static final String CRITICAL_SUSPICION = "critical_suspicion";
    public static final String MULTIPLE_RISK_FACTORS = "multiple_risk_factors";

    private static final BigInteger LARGE_TRANSFER_WEI = BigInteger.TEN.pow(18);
    private static final int MULTIPLE_FACTORS_THRESHOLD = 3;

    private PatternDetector() {
    }

    public static List<DetectedPattern> detect(ProcessedEvent event) {
        List<DetectedPattern> patterns = new ArrayList<>();
        String hash = event.transactionHash();
        Optional<BigInteger> amount = safeAmount(event);

        if (event.eventType() == EventType.TRANSFER
                && amount.map(a -> a.compareTo(LARGE_TRANSFER_WEI) > 0).orElse(false)) {
            patterns.add(new DetectedPattern(LARGE_TRANSFER, hash, 0.8,
                    "Large transfer detected: " + amount.get() + " wei"));
        } else if (event.eventType() == EventType.APPROVAL
                && amount.map(ApprovalRiskAnalyzer::isUnlimited).orElse(false)) {
            patterns.add(new DetectedPattern(UNLIMITED_APPROVAL, hash, 0.9, "Unlimited approval detected"));
        }
        if (event.touchesZeroAddress()) {
            patterns.add(new DetectedPattern(ZERO_ADDRESS_INTERACTION, hash, 0.7, "Zero address interaction detected"));
        }
        if (event.suspicionLevel() == SuspicionLevel.CRITICAL) {
            patterns.add(new DetectedPattern(CRITICAL_SUSPICION, hash, 0.95,
                    "Critical suspicion level: " + event.suspicionLevel()));
        }
        if (event.riskFactors().size() >= MULTIPLE_FACTORS_THRESHOLD) {
            patterns.add(new DetectedPattern(MULTIPLE_RISK_FACTORS, hash, 0.8,
                    "Multiple risk factors detected: " + event.riskFactors().size()));
        }
        return patterns;
    }

    private static Optional<BigInteger> safeAmount(ProcessedEvent event) {
        try {
            return event.amount();
        } catch (MalformedEventException e) {
            return Optional.empty();
        }
    }
}
