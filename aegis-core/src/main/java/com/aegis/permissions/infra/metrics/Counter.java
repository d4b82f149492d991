/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics;

/**
 * Monotonically increasing counter. Thread-safe.
 */
public interface Counter {
    void increment();

    void increment(long amount);

    long count();
}
