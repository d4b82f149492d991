/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Latency recorder. Thread-safe.
 */
public interface Timer {

    /**
     * Times a computation and returns its result. The duration is recorded even if it throws.
     */
    <T> T record(Supplier<T> supplier);

    void record(Duration duration);

    long count();

    /**
     * Mean of all recorded durations, or {@link Duration#ZERO} when none were recorded.
     */
    Duration mean();
}
