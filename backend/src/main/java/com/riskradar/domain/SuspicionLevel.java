package com.riskradar.domain;

/**
 * Ordinal severity attached to a processed event. Declaration order is severity order.
 */
public enum SuspicionLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(SuspicionLevel other) {
        return compareTo(other) >= 0;
    }
}
