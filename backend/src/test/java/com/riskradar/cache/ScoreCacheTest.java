package com.riskradar.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.riskradar.domain.AddressReputation;
import com.riskradar.support.StubFactProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.riskradar.support.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    @Test
    @DisplayName("second lookup within the TTL is served from the cache")
    void cachesFoundValues() {
        StubFactProvider<BigDecimal> prices = new StubFactProvider<BigDecimal>(FactKind.PRICE).with(USDT, BigDecimal.ONE);
        ScoreCache cache = cache(prices);

        assertThat(cache.lookup(FactKind.PRICE, USDT, BigDecimal.class)).contains(BigDecimal.ONE);
        assertThat(cache.lookup(FactKind.PRICE, USDT.toUpperCase().replace("0X", "0x"), BigDecimal.class))
                .contains(BigDecimal.ONE);

        assertThat(prices.calls()).isEqualTo(1);
        assertThat(cache.statistics().hits()).isEqualTo(1);
        assertThat(cache.peek(FactKind.PRICE, USDT)).get().extracting(CacheEntry::insertedAt).isEqualTo(NOW);
    }

    @Test
    @DisplayName("an entry older than the TTL is a miss on read")
    void expiresOnRead() {
        StubFactProvider<BigDecimal> prices = new StubFactProvider<BigDecimal>(FactKind.PRICE).with(USDT, BigDecimal.TEN);
        ScoreCache cache = cache(prices);

        cache.lookup(FactKind.PRICE, USDT, BigDecimal.class);
        nanos.addAndGet(Duration.ofSeconds(301).toNanos());

        assertThat(cache.peek(FactKind.PRICE, USDT)).isEmpty();
        assertThat(cache.lookup(FactKind.PRICE, USDT, BigDecimal.class)).contains(BigDecimal.TEN);
        assertThat(prices.calls()).isEqualTo(2);
    }

    @Test
    @DisplayName("provider failures and empty answers are not cached")
    void failuresAreMisses() {
        StubFactProvider<AddressReputation> reputations = new StubFactProvider<>(FactKind.REPUTATION);
        ScoreCache cache = cache(reputations);
        reputations.failWith(new IllegalStateException("rate limited"));

        assertThat(cache.lookup(FactKind.REPUTATION, ALICE, AddressReputation.class)).isEmpty();
        assertThat(cache.statistics().providerFailures()).isEqualTo(1);

        reputations.failWith(null);
        assertThat(cache.lookup(FactKind.REPUTATION, ALICE, AddressReputation.class)).isEmpty();
        reputations.with(ALICE, new AddressReputation(ALICE, Set.of("mixer")));
        assertThat(cache.lookup(FactKind.REPUTATION, ALICE, AddressReputation.class)).isPresent();
        assertThat(reputations.calls()).isEqualTo(3);
    }

    @Test
    @DisplayName("no provider for a kind, or a blank subject, yields empty without failing")
    void missingProviderOrSubject() {
        ScoreCache cache = cache();

        assertThat(cache.lookup(FactKind.HISTORY, ALICE, Object.class)).isEmpty();
        assertThat(cache.lookup(FactKind.HISTORY, " ", Object.class)).isEmpty();
        assertThat(cache.lookup(FactKind.HISTORY, null, Object.class)).isEmpty();
    }

    @Test
    @DisplayName("two providers of the same kind are rejected")
    void duplicateProviders() {
        assertThatThrownBy(() -> cache(new StubFactProvider<BigDecimal>(FactKind.PRICE),
                new StubFactProvider<BigDecimal>(FactKind.PRICE)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PRICE");
    }

    @Test
    @DisplayName("concurrent lookups always see a complete value")
    void concurrentLookups() throws InterruptedException {
        StubFactProvider<BigDecimal> prices = new StubFactProvider<>(FactKind.PRICE);
        for (int i = 0; i < 50; i++) {
            prices.with(String.format("0x%040x", i), BigDecimal.valueOf(i));
        }
        ScoreCache cache = cache(prices);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wrong = new AtomicInteger();
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int round = 0; round < 20; round++) {
                    for (int i = 0; i < 50; i++) {
                        Optional<BigDecimal> v = cache.lookup(FactKind.PRICE, String.format("0x%040x", i), BigDecimal.class);
                        if (v.isEmpty() || v.get().intValue() != i) {
                            wrong.incrementAndGet();
                        }
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        assertThat(wrong.get()).isZero();
        assertThat(cache.statistics().size()).isEqualTo(50);
    }

    private ScoreCache cache(FactProvider<?>... providers) {
        return new ScoreCache(Duration.ofSeconds(300), 1_000, ticker, CLOCK, List.of(providers));
    }
}
