package com.riskradar.stage;

import com.riskradar.domain.EventType;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.Recommendation;
import com.riskradar.domain.RiskAssessment;
import com.riskradar.domain.RiskCategory;
import com.riskradar.domain.SuspicionLevel;
import com.riskradar.risk.RiskAssessmentEngine;
import com.riskradar.risk.config.RiskProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventAnalysisStageTest {

    private final RiskAssessmentEngine engine = mock(RiskAssessmentEngine.class);
    private final EventAnalysisStage stage = new EventAnalysisStage(engine, new RiskProperties(), CLOCK);

    @Test
    @DisplayName("suspicion follows the score thresholds once confidence is high enough")
    void suspicionMapping() {
        assertThat(stage.suspicionFor(assessment(0.95, 0.8))).isEqualTo(SuspicionLevel.CRITICAL);
        assertThat(stage.suspicionFor(assessment(0.9, 0.8))).isEqualTo(SuspicionLevel.CRITICAL);
        assertThat(stage.suspicionFor(assessment(0.75, 0.8))).isEqualTo(SuspicionLevel.HIGH);
        assertThat(stage.suspicionFor(assessment(0.5, 0.8))).isEqualTo(SuspicionLevel.MEDIUM);
        assertThat(stage.suspicionFor(assessment(0.2, 0.8))).isEqualTo(SuspicionLevel.LOW);
        assertThat(stage.suspicionFor(assessment(0.99, 0.5))).isEqualTo(SuspicionLevel.LOW);
    }

    @Test
    @DisplayName("priority tags come first in fixed order, unknown tags follow alphabetically, no duplicates")
    void mergeFactors() {
        List<String> merged = EventAnalysisStage.mergeFactors(
                List.of("zeta", "REPUTATION_RISK", "alpha"),
                List.of("UNLIMITED_APPROVAL", "REPUTATION_RISK", "CRITICAL_FINANCIAL_IMPACT"));

        assertThat(merged).containsExactly(
                "CRITICAL_FINANCIAL_IMPACT", "UNLIMITED_APPROVAL", "REPUTATION_RISK", "alpha", "zeta");
    }

    @Test
    @DisplayName("analysis keeps the higher of incoming and computed suspicion and collects patterns")
    void analyze() {
        ProcessedEvent alreadyCritical = transfer(txHash(1), ALICE, BOB, ONE_TOKEN.multiply(BigInteger.TEN))
                .withAnalysis(SuspicionLevel.CRITICAL, List.of());
        ProcessedEvent quiet = event(txHash(2), EventType.UNKNOWN, USDT, Map.of());
        when(engine.assess(any())).thenAnswer(inv -> {
            ProcessedEvent e = inv.getArgument(0);
            return e.transactionHash().equals(txHash(1))
                    ? assessment(0.75, 0.8, "HIGH_FINANCIAL_IMPACT")
                    : assessment(0.1, 0.8);
        });

        EventAnalysisOutcome outcome = stage.analyze(new EventAnalysisRequest(List.of(alreadyCritical, quiet), "normal"));

        assertThat(outcome.processedEvents()).extracting(ProcessedEvent::suspicionLevel)
                .containsExactly(SuspicionLevel.CRITICAL, SuspicionLevel.LOW);
        assertThat(outcome.processedEvents().get(0).riskFactors()).containsExactly("HIGH_FINANCIAL_IMPACT");
        assertThat(outcome.patterns()).extracting(DetectedPattern::patternType)
                .containsExactly(PatternDetector.LARGE_TRANSFER, PatternDetector.CRITICAL_SUSPICION);
        // 0.7 base + 2 patterns x 0.1 + 1 event with args x 0.05
        assertThat(outcome.confidence()).isCloseTo(0.95, within(1e-9));
        assertThat(outcome.processingTimeSeconds()).isZero();
    }

    @Test
    @DisplayName("confidence boosts are capped and an empty batch has none")
    void confidenceBounds() {
        List<ProcessedEvent> events = List.of(transfer(txHash(1), ALICE, BOB, ONE_TOKEN));
        List<DetectedPattern> many = List.of(
                new DetectedPattern("a", "h", 1, ""), new DetectedPattern("b", "h", 1, ""),
                new DetectedPattern("c", "h", 1, ""), new DetectedPattern("d", "h", 1, ""));

        assertThat(EventAnalysisStage.confidence(events, many)).isCloseTo(1.0, within(1e-9));
        assertThat(EventAnalysisStage.confidence(List.of(), many)).isZero();
    }

    @Test
    @DisplayName("pass-through marks everything LOW with no patterns")
    void passThrough() {
        ProcessedEvent flagged = transfer(txHash(1), ALICE, BOB, ONE_TOKEN)
                .withAnalysis(SuspicionLevel.HIGH, List.of("TAG"));

        EventAnalysisOutcome outcome = EventAnalysisStage.passThrough(List.of(flagged));

        assertThat(outcome.processedEvents()).singleElement().satisfies(e -> {
            assertThat(e.suspicionLevel()).isEqualTo(SuspicionLevel.LOW);
            assertThat(e.riskFactors()).containsExactly("TAG");
        });
        assertThat(outcome.patterns()).isEmpty();
        assertThat(outcome.confidence()).isEqualTo(EventAnalysisStage.PASS_THROUGH_CONFIDENCE);
        assertThat(EventAnalysisStage.passThrough(List.of()).confidence()).isZero();
    }

    private static RiskAssessment assessment(double score, double confidence, String... factors) {
        return new RiskAssessment(txHash(0), 0, score, confidence, RiskCategory.FINANCIAL, List.of(factors),
                Recommendation.MONITOR, Map.of(), NOW);
    }
}
