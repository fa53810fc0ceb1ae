package com.riskradar.stage;

import com.riskradar.domain.Addresses;
import com.riskradar.domain.EventType;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.SuspicionLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class PatternDetectorTest {

    @Test
    @DisplayName("transfer above one token is a large transfer; exactly one token is not")
    void largeTransfer() {
        assertThat(PatternDetector.detect(transfer(txHash(1), ALICE, BOB, ONE_TOKEN.add(BigInteger.ONE))))
                .extracting(DetectedPattern::patternType)
                .containsExactly(PatternDetector.LARGE_TRANSFER);
        assertThat(PatternDetector.detect(transfer(txHash(2), ALICE, BOB, ONE_TOKEN))).isEmpty();
    }

    @Test
    @DisplayName("max uint256 approval is unlimited")
    void unlimitedApproval() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

        List<DetectedPattern> patterns = PatternDetector.detect(approval(txHash(3), ALICE, RECEIVER, max));

        assertThat(patterns).singleElement().satisfies(p -> {
            assertThat(p.patternType()).isEqualTo(PatternDetector.UNLIMITED_APPROVAL);
            assertThat(p.confidence()).isEqualTo(0.9);
            assertThat(p.transactionHash()).isEqualTo(txHash(3));
        });
    }

    @Test
    @DisplayName("mint from the zero address, critical suspicion and three tags stack up")
    void stackedPatterns() {
        ProcessedEvent mint = transfer(txHash(4), Addresses.ZERO_ADDRESS, BOB, ONE_TOKEN.multiply(BigInteger.TEN))
                .withAnalysis(SuspicionLevel.CRITICAL, List.of("A", "B", "C"));

        assertThat(PatternDetector.detect(mint)).extracting(DetectedPattern::patternType).containsExactly(
                PatternDetector.LARGE_TRANSFER,
                PatternDetector.ZERO_ADDRESS_INTERACTION,
                PatternDetector.CRITICAL_SUSPICION,
                PatternDetector.MULTIPLE_RISK_FACTORS);
    }

    @Test
    @DisplayName("unparseable amount is skipped without failing detection")
    void malformedAmount() {
        ProcessedEvent event = event(txHash(5), EventType.TRANSFER, USDT,
                Map.of("from", ALICE, "to", BOB, "value", "lots"));

        assertThat(PatternDetector.detect(event)).isEmpty();
    }
}
