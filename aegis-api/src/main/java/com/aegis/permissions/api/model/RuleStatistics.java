/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;
import java.util.Map;

/**
 * Static statistics about a configuration's rules.
 */
public record RuleStatistics(
        int totalRules,
        Map<RuleCategory, Integer> byCategory,
        Complexity complexity,
        Coverage coverage
) {
    public RuleStatistics {
        byCategory = Map.copyOf(byCategory);
    }

    public record Complexity(
            double averagePatternLength,
            int maxPatternLength,
            int regexPatterns,
            int globPatterns,
            int literalPatterns
    ) {
    }

    /**
     * @param estimatedCoverage heuristic 0-100 coverage estimate
     * @param uncoveredRules    allow/ask rules no deny rule is related to
     * @param redundantRules    rules whose exact pattern appears more than once in a category
     */
    public record Coverage(int estimatedCoverage, List<String> uncoveredRules, List<String> redundantRules) {
        public Coverage {
            uncoveredRules = List.copyOf(uncoveredRules);
            redundantRules = List.copyOf(redundantRules);
        }
    }
}
