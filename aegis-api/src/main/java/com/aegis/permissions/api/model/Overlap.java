/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;

/**
 * Overlap between two rules, derived from a bounded probe corpus.
 *
 * @param ruleA           first rule
 * @param ruleB           second rule
 * @param kind            relationship of A's match set to B's
 * @param exampleInputs   up to five inputs matched by both rules
 * @param confidence      0-100, how much the probe corpus supports the verdict
 * @param coveragePercent share of the corpus matched by both rules
 */
public record Overlap(
        NormalizedRule ruleA,
        NormalizedRule ruleB,
        OverlapKind kind,
        List<String> exampleInputs,
        double confidence,
        double coveragePercent
) {
    public static final int MAX_EXAMPLES = 5;

    public Overlap {
        exampleInputs = List.copyOf(exampleInputs);
    }

    public static Overlap none(NormalizedRule a, NormalizedRule b) {
        return new Overlap(a, b, OverlapKind.NONE, List.of(), 0.0, 0.0);
    }

    public boolean overlaps() {
        return kind != OverlapKind.NONE;
    }
}
