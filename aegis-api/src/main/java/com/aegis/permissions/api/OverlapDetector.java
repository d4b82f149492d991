/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.Overlap;

import java.util.Collection;
import java.util.List;

/**
 * Decides how the match sets of two rules relate.
 *
 * <p>Conflict detection and resolution depend only on this interface. The shipped implementation
 * is a bounded probe-corpus heuristic; an exact intersection algorithm can replace it without
 * touching its callers.
 */
public interface OverlapDetector {

    /**
     * Analyzes the overlap of {@code ruleA} with {@code ruleB}. Subset and superset are stated
     * from A's point of view.
     *
     * @param extraProbes additional candidate inputs to test, may be empty
     */
    Overlap analyzeOverlap(NormalizedRule ruleA, NormalizedRule ruleB, Collection<String> extraProbes);

    default Overlap analyzeOverlap(NormalizedRule ruleA, NormalizedRule ruleB) {
        return analyzeOverlap(ruleA, ruleB, List.of());
    }
}
