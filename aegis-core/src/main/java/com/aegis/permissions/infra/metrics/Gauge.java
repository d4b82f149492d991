/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.infra.metrics;

/**
 * Instantaneous value. Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();
}
