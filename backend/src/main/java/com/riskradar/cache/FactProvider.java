package com.riskradar.cache;

import java.util.Optional;

/**
 * Source of one kind of fact (price, reputation, history). Implementations may block on I/O;
 * callers treat an exception the same as an empty result.
 */
public interface FactProvider<T> {

    FactKind kind();

    Optional<T> lookup(String subjectId);
}
