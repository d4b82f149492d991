/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Registries are injected into the components that record metrics; there is no global instance.
 *
 * <pre>{@code
 * MetricsRegistry metrics = new InMemoryMetricsRegistry();
 * ValidationEngine engine = ValidationEngine.builder().metrics(metrics).build();
 * metrics.counter("aegis.validations").count();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name dotted metric name, e.g. {@code aegis.cache.hits}
     */
    Counter counter(String name);

    Gauge gauge(String name);

    Timer timer(String name);

    /**
     * Registry that records nothing.
     */
    static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }
}
