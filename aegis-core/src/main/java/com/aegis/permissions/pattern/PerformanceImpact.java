/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

/**
 * Expected matching cost of a pattern, derived from its complexity score.
 */
public enum PerformanceImpact {
    NEGLIGIBLE,
    LOW,
    MEDIUM,
    HIGH;

    static PerformanceImpact forComplexity(double complexity) {
        if (complexity > 70) {
            return HIGH;
        }
        if (complexity > 40) {
            return MEDIUM;
        }
        if (complexity > 20) {
            return LOW;
        }
        return NEGLIGIBLE;
    }
}
