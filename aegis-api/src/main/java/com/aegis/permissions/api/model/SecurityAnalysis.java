/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;

/**
 * Security posture of a configuration.
 *
 * @param score           0-100; 100 minus 20 per critical, 10 per high and 5 per medium issue
 * @param issues          detected issues
 * @param bypassVectors   descriptions of known ways around the deny rules
 * @param recommendations follow-up actions
 */
public record SecurityAnalysis(
        int score,
        List<SecurityIssue> issues,
        List<String> bypassVectors,
        List<String> recommendations
) {
    public SecurityAnalysis {
        issues = List.copyOf(issues);
        bypassVectors = List.copyOf(bypassVectors);
        recommendations = List.copyOf(recommendations);
    }
}
