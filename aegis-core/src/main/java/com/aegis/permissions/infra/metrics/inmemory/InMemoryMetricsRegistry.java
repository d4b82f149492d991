/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics.inmemory;

import com.aegis.permissions.infra.metrics.Counter;
import com.aegis.permissions.infra.metrics.Gauge;
import com.aegis.permissions.infra.metrics.MetricsRegistry;
import com.aegis.permissions.infra.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry keeping every metric in memory, for tests and diagnostics.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name) {
        return counters.computeIfAbsent(name, n -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name) {
        return gauges.computeIfAbsent(name, n -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name) {
        return timers.computeIfAbsent(name, InMemoryTimer::new);
    }

    /**
     * Sorted snapshot of counter values.
     */
    public Map<String, Long> counterSnapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.count()));
        return snapshot;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
