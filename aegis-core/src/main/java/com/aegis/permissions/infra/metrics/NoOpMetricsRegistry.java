/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Registry whose metrics discard every recording.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter COUNTER = new Counter() {
        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0L;
        }
    };

    private static final Gauge GAUGE = new Gauge() {
        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }
    };

    private static final Timer TIMER = new Timer() {
        @Override
        public <T> T record(Supplier<T> supplier) {
            return supplier.get();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0L;
        }

        @Override
        public Duration mean() {
            return Duration.ZERO;
        }
    };

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name) {
        return TIMER;
    }
}
