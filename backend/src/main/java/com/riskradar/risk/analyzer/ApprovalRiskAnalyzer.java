package com.riskradar.risk.analyzer;

import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.EventType;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.MalformedEventException;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.RiskCategory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Allowance size risk for Approval events only.
 */
@Component
public class ApprovalRiskAnalyzer implements FactorAnalyzer {

    /** 2^256 - 1, the conventional "infinite" allowance. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    static final BigInteger UNLIMITED_FLOOR = BigInteger.TEN.pow(30);
    static final BigInteger LARGE_FLOOR = BigInteger.TEN.pow(24);

    @Override
    public RiskCategory category() {
        return RiskCategory.APPROVAL;
    }

    @Override
    public boolean appliesTo(ProcessedEvent event) {
        return event.eventType() == EventType.APPROVAL;
    }

    @Override
    public FactorResult assess(ProcessedEvent event, ScoreCache cache) {
        Optional<BigInteger> amount;
        try {
            amount = event.amount();
        } catch (MalformedEventException e) {
            amount = Optional.empty();
        }
        if (amount.isEmpty()) {
            return FactorResult.of(0.3, 0.3, "APPROVAL_AMOUNT_UNKNOWN");
        }
        return classify(amount.get());
    }

    static FactorResult classify(BigInteger allowance) {
        if (isUnlimited(allowance)) {
            return FactorResult.of(0.9, 0.8, "UNLIMITED_APPROVAL");
        }
        if (allowance.compareTo(LARGE_FLOOR) > 0) {
            return FactorResult.of(0.7, 0.8, "LARGE_APPROVAL");
        }
        return FactorResult.of(0.3, 0.8, "NORMAL_APPROVAL");
    }

    public static boolean isUnlimited(BigInteger allowance) {
        return allowance.equals(MAX_UINT256) || allowance.compareTo(UNLIMITED_FLOOR) > 0;
    }
}
