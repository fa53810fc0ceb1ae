package com.riskradar.risk.analyzer;

import com.riskradar.cache.FactKind;
import com.riskradar.domain.AddressHistory;
import com.riskradar.domain.FactorResult;
import com.riskradar.support.StubFactProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HistoricalContextAnalyzerTest {

    private final HistoricalContextAnalyzer analyzer = new HistoricalContextAnalyzer(CLOCK);

    @Test
    @DisplayName("unknown sender: no history and no contract interactions")
    void unknownSender() {
        FactorResult r = analyzer.assess(transfer(txHash(1), ALICE, BOB, ONE_TOKEN), cache());

        assertThat(r.score()).isCloseTo(0.6, within(1e-9));
        assertThat(r.confidence()).isEqualTo(0.4);
        assertThat(r.factors()).containsExactly("NO_TRANSACTION_HISTORY", "NO_CONTRACT_INTERACTIONS");
    }

    @Test
    @DisplayName("long-lived busy account gets the standard context tag")
    void establishedAccount() {
        Set<String> contracts = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            contracts.add(String.format("0x%040x", i + 1));
        }
        AddressHistory history = new AddressHistory(200, ONE_TOKEN, ONE_TOKEN.multiply(BigInteger.valueOf(200)),
                contracts, NOW.minus(Duration.ofDays(365)), NOW.minus(Duration.ofHours(2)), 1.5);

        FactorResult r = analyzer.assess(transfer(txHash(2), ALICE, BOB, ONE_TOKEN),
                cache(new StubFactProvider<AddressHistory>(FactKind.HISTORY).with(ALICE, history)));

        assertThat(r.score()).isZero();
        assertThat(r.confidence()).isEqualTo(0.8);
        assertThat(r.factors()).containsExactly("STANDARD_HISTORICAL_CONTEXT");
    }

    @Test
    @DisplayName("week-old account moving more than half its lifetime volume")
    void youngAccountLargeShare() {
        AddressHistory history = new AddressHistory(8, ONE_TOKEN, ONE_TOKEN.multiply(BigInteger.valueOf(8)),
                Set.of(BOB), NOW.minus(Duration.ofDays(3)), NOW.minus(Duration.ofDays(1)), 0.0);

        FactorResult r = analyzer.assess(transfer(txHash(3), ALICE, BOB, ONE_TOKEN.multiply(BigInteger.TEN)),
                cache(new StubFactProvider<AddressHistory>(FactKind.HISTORY).with(ALICE, history)));

        assertThat(r.factors()).containsExactly("VERY_NEW_ACCOUNT", "LARGE_VALUE_RATIO", "INACTIVE_ACCOUNT");
        assertThat(r.score()).isCloseTo(0.7, within(1e-9));
        assertThat(r.confidence()).isEqualTo(0.6);
    }
}
