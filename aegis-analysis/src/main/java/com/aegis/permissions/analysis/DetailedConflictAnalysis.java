/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ResolutionStrategy;

import java.util.List;

/**
 * In-depth view of one conflict, for reports and interactive review.
 *
 * @param conflict          the conflict
 * @param attackVectors     ways an attacker could exploit it
 * @param resolutionOptions applicable strategies, preferred first
 * @param confidence        0-100 confidence that the conflict is real
 * @param relatedConflicts  messages of other conflicts sharing a pattern with this one
 */
public record DetailedConflictAnalysis(
        Conflict conflict,
        List<String> attackVectors,
        List<ResolutionOption> resolutionOptions,
        double confidence,
        List<String> relatedConflicts
) {
    public DetailedConflictAnalysis {
        attackVectors = List.copyOf(attackVectors);
        resolutionOptions = List.copyOf(resolutionOptions);
        relatedConflicts = List.copyOf(relatedConflicts);
    }

    /**
     * @param strategy      resolution strategy
     * @param description   what the strategy does for this conflict
     * @param risk          risk of applying it
     * @param automatedFix  whether an automatic fix can be produced
     */
    public record ResolutionOption(ResolutionStrategy strategy, String description, ChangeRisk risk,
                                   boolean automatedFix) {
    }
}
