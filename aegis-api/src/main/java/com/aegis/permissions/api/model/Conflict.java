/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A detected conflict between rules, or a security weakness of a single rule.
 */
public record Conflict(
        ConflictKind kind,
        String message,
        List<ConflictingRule> conflictingRules,
        ResolutionStrategy resolutionStrategy,
        Severity securityImpact
) {
    public Conflict {
        conflictingRules = List.copyOf(conflictingRules);
    }

    /**
     * Deduplication key: the conflict kind plus the sorted patterns involved.
     */
    public String deduplicationKey() {
        return kind + "|" + conflictingRules.stream()
                .map(ConflictingRule::pattern)
                .sorted()
                .collect(Collectors.joining("|"));
    }

    public boolean involves(RuleCategory category) {
        return conflictingRules.stream().anyMatch(r -> r.category() == category);
    }
}
