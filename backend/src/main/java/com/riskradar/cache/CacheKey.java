package com.riskradar.cache;

import java.util.Locale;
import java.util.Objects;

/**
 * Cache key: fact kind plus subject (address or contract), lowercased so checksum and plain
 * spellings of an address share one entry.
 */
public record CacheKey(FactKind kind, String subjectId) {

    public CacheKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subjectId, "subjectId");
        subjectId = subjectId.strip().toLowerCase(Locale.ROOT);
    }
}
