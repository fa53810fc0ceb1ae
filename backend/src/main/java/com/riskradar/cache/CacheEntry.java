package com.riskradar.cache;

import java.time.Instant;

/**
 * Cached fact with its insertion time. Entries are replaced, never mutated.
 */
public record CacheEntry(CacheKey key, Object value, Instant insertedAt) {
}
