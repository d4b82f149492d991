/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.PatternWeakness;

import java.util.List;

/**
 * Static analysis of one pattern.
 *
 * @param pattern           pattern text
 * @param kind              pattern kind
 * @param complexity        0-100, higher is harder to reason about and slower to match
 * @param specificity       0-100, higher matches fewer inputs
 * @param weaknesses        intrinsic weaknesses
 * @param signature         coarse grouping key
 * @param coverage          0-100 estimate of the share of inputs matched
 * @param performanceImpact expected matching cost
 */
public record PatternAnalysis(
        String pattern,
        PatternKind kind,
        double complexity,
        int specificity,
        List<PatternWeakness> weaknesses,
        String signature,
        int coverage,
        PerformanceImpact performanceImpact
) {
    public PatternAnalysis {
        weaknesses = List.copyOf(weaknesses);
    }
}
