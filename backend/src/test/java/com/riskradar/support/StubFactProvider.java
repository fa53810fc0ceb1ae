package com.riskradar.support;

import com.riskradar.cache.FactKind;
import com.riskradar.cache.FactProvider;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider keyed by lowercase subject. Counts calls and can be switched to failing.
 */
public class StubFactProvider<T> implements FactProvider<T> {

    private final FactKind kind;
    private final Map<String, T> values = new HashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile RuntimeException failure;

    public StubFactProvider(FactKind kind) {
        this.kind = kind;
    }

    public StubFactProvider<T> with(String subject, T value) {
        values.put(subject.toLowerCase(Locale.ROOT), value);
        return this;
    }

    public void failWith(RuntimeException e) {
        this.failure = e;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public FactKind kind() {
        return kind;
    }

    @Override
    public Optional<T> lookup(String subjectId) {
        calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(values.get(subjectId));
    }
}
