package com.riskradar.cache;

/**
 * Kinds of externally sourced facts held in the score cache.
 */
public enum FactKind {
    /** USD price of a token, keyed by token contract. */
    PRICE,
    /** Security indicators of an address. */
    REPUTATION,
    /** Activity summary of an address. */
    HISTORY
}
