package com.riskradar.cache;

/**
 * Snapshot of score cache counters for the stats endpoint.
 */
public record CacheStatistics(long hits, long misses, double hitRate, long size, long providerFailures) {
}
