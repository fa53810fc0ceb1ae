package com.riskradar.risk.analyzer;

import com.riskradar.cache.FactKind;
import com.riskradar.cache.ScoreCache;
import com.riskradar.domain.AddressReputation;
import com.riskradar.domain.FactorResult;
import com.riskradar.support.StubFactProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ReputationRiskAnalyzerTest {

    private final ReputationRiskAnalyzer analyzer = new ReputationRiskAnalyzer();

    @Test
    @DisplayName("no reputation data degrades to 0.3/0.3")
    void noData() {
        FactorResult r = analyzer.assess(transfer(txHash(1), ALICE, BOB, ONE_TOKEN), cache());

        assertThat(r.score()).isEqualTo(0.3);
        assertThat(r.factors()).containsExactly("REPUTATION_DATA_UNAVAILABLE");
    }

    @Test
    @DisplayName("clean addresses score zero with high confidence")
    void cleanAddresses() {
        FactorResult r = analyzer.assess(transfer(txHash(2), ALICE, BOB, ONE_TOKEN), reputations(Set.of(), Set.of()));

        assertThat(r.score()).isZero();
        assertThat(r.confidence()).isEqualTo(0.8);
        assertThat(r.factors()).containsExactly("NO_REPUTATION_FLAGS");
    }

    @Test
    @DisplayName("heaviest indicator across sender and counterparty wins; critical ones score 0.95")
    void heaviestIndicatorWins() {
        FactorResult r = analyzer.assess(transfer(txHash(3), ALICE, BOB, ONE_TOKEN),
                reputations(Set.of("mixer"), Set.of("sanctioned", "fake_token")));

        assertThat(r.score()).isEqualTo(ReputationRiskAnalyzer.CRITICAL_SCORE);
        assertThat(r.confidence()).isEqualTo(0.9);
        assertThat(r.factors()).containsExactly("REPUTATION_RISK", "MIXER", "FAKE_TOKEN", "CRITICAL_SANCTIONED");
    }

    @Test
    @DisplayName("zero address is never looked up")
    void skipsZeroAddress() {
        StubFactProvider<AddressReputation> provider = new StubFactProvider<>(FactKind.REPUTATION);

        analyzer.assess(transfer(txHash(4), "0x0000000000000000000000000000000000000000", BOB, ONE_TOKEN), cache(provider));

        assertThat(provider.calls()).isEqualTo(1);
    }

    private static ScoreCache reputations(Set<String> alice, Set<String> bob) {
        return cache(new StubFactProvider<AddressReputation>(FactKind.REPUTATION)
                .with(ALICE, new AddressReputation(ALICE, alice))
                .with(BOB, new AddressReputation(BOB, bob)));
    }
}
