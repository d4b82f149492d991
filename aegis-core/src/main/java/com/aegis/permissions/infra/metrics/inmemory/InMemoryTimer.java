/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics.inmemory;

import com.aegis.permissions.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Timer keeping a running count and total.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Supplier<T> supplier) {
        long start = System.nanoTime();
        try {
            return supplier.get();
        } finally {
            record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        count.increment();
        totalNanos.add(duration.toNanos());
    }

    @Override
    public long count() {
        return count.sum();
    }

    @Override
    public Duration mean() {
        long n = count.sum();
        return n == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos.sum() / n);
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d, mean=%.3fms}",
                name, count(), mean().toNanos() / 1_000_000.0);
    }
}
