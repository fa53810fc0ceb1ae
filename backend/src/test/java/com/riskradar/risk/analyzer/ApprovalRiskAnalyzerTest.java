package com.riskradar.risk.analyzer;

import com.riskradar.domain.EventType;
import com.riskradar.domain.FactorResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ApprovalRiskAnalyzerTest {

    private final ApprovalRiskAnalyzer analyzer = new ApprovalRiskAnalyzer();

    @Test
    @DisplayName("applies to approvals only")
    void appliesToApprovals() {
        assertThat(analyzer.appliesTo(approval(txHash(1), ALICE, BOB, BigInteger.ONE))).isTrue();
        assertThat(analyzer.appliesTo(transfer(txHash(2), ALICE, BOB, BigInteger.ONE))).isFalse();
    }

    @Test
    @DisplayName("max uint256 and anything above 1e30 count as unlimited")
    void unlimited() {
        FactorResult r = analyzer.assess(approval(txHash(3), ALICE, BOB, ApprovalRiskAnalyzer.MAX_UINT256), cache());

        assertThat(r.score()).isEqualTo(0.9);
        assertThat(r.factors()).containsExactly("UNLIMITED_APPROVAL");
        assertThat(ApprovalRiskAnalyzer.isUnlimited(BigInteger.TEN.pow(31))).isTrue();
        assertThat(ApprovalRiskAnalyzer.isUnlimited(BigInteger.TEN.pow(30))).isFalse();
    }

    @Test
    @DisplayName("large and normal allowances")
    void largeAndNormal() {
        assertThat(analyzer.assess(approval(txHash(4), ALICE, BOB, BigInteger.TEN.pow(25)), cache()).factors())
                .containsExactly("LARGE_APPROVAL");
        assertThat(analyzer.assess(approval(txHash(5), ALICE, BOB, ONE_TOKEN), cache()).score()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("hex allowance is parsed; missing allowance degrades")
    void parsingEdgeCases() {
        FactorResult hex = analyzer.assess(event(txHash(6), EventType.APPROVAL, USDT,
                Map.of("owner", ALICE, "spender", BOB, "value", "0x" + "f".repeat(64))), cache());
        FactorResult missing = analyzer.assess(event(txHash(7), EventType.APPROVAL, USDT,
                Map.of("owner", ALICE, "spender", BOB)), cache());

        assertThat(hex.factors()).containsExactly("UNLIMITED_APPROVAL");
        assertThat(missing.factors()).containsExactly("APPROVAL_AMOUNT_UNKNOWN");
        assertThat(missing.confidence()).isEqualTo(0.3);
    }
}
