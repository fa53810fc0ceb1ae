package com.riskradar.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of external facts in front of the registered {@link FactProvider}s.
 * Expiry is checked on read, so an entry older than the TTL is a miss even if it was never evicted.
 * Only found values are cached; a provider that fails or returns nothing is asked again next time.
 * Concurrent misses on one key may both call the provider; the last write wins.
 */
@Slf4j
public class ScoreCache {

    private final Cache<CacheKey, CacheEntry> entries;
    private final Map<FactKind, FactProvider<?>> providers = new EnumMap<>(FactKind.class);
    private final Clock clock;
    private final AtomicLong providerFailures = new AtomicLong();

    public ScoreCache(Duration ttl, long maximumSize, Ticker ticker, Clock clock,
                      Collection<? extends FactProvider<?>> factProviders) {
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .recordStats()
                .build();
        this.clock = clock;
        for (FactProvider<?> provider : factProviders) {
            FactProvider<?> previous = providers.put(provider.kind(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate fact provider for " + provider.kind()
                        + ": " + previous.getClass().getSimpleName() + ", " + provider.getClass().getSimpleName());
            }
        }
    }

    /**
     * Cached value for (kind, subjectId), loading it from the provider on a miss.
     * Empty when there is no provider for the kind, the provider has no data, or it failed.
     */
    public <T> Optional<T> lookup(FactKind kind, String subjectId, Class<T> type) {
        if (subjectId == null || subjectId.isBlank()) {
            return Optional.empty();
        }
        CacheKey key = new CacheKey(kind, subjectId);
        CacheEntry cached = entries.getIfPresent(key);
        if (cached != null && type.isInstance(cached.value())) {
            return Optional.of(type.cast(cached.value()));
        }
        FactProvider<?> provider = providers.get(kind);
        if (provider == null) {
            return Optional.empty();
        }
        Optional<?> loaded;
        try {
            loaded = provider.lookup(key.subjectId());
        } catch (RuntimeException e) {
            providerFailures.incrementAndGet();
            log.debug("{} lookup failed for {}: {}", kind, key.subjectId(), e.getMessage());
            return Optional.empty();
        }
        if (loaded == null || loaded.isEmpty() || !type.isInstance(loaded.get())) {
            return Optional.empty();
        }
        put(key, loaded.get());
        return Optional.of(type.cast(loaded.get()));
    }

    public void put(FactKind kind, String subjectId, Object value) {
        put(new CacheKey(kind, subjectId), value);
    }

    /** Current entry without loading; respects the TTL. */
    public Optional<CacheEntry> peek(FactKind kind, String subjectId) {
        return Optional.ofNullable(entries.getIfPresent(new CacheKey(kind, subjectId)));
    }

    public CacheStatistics statistics() {
        CacheStats stats = entries.stats();
        return new CacheStatistics(stats.hitCount(), stats.missCount(), stats.hitRate(),
                entries.estimatedSize(), providerFailures.get());
    }

    private void put(CacheKey key, Object value) {
        entries.put(key, new CacheEntry(key, value, clock.instant()));
    }
}
