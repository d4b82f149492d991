/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.ValidationWarning;
import com.aegis.permissions.api.model.ValidationWarningType;
import com.aegis.permissions.pattern.PatternAnalyzer;
import com.aegis.permissions.pattern.PatternEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-rule checks that need no knowledge of other rules. Every finding is a warning:
 * a bad rule stays in the normalized set so conflict detection still sees it.
 */
public final class RuleValidator {

    private static final List<String> DANGEROUS_TOKENS = List.of(
            "exec", "eval", "shell", "cmd", "powershell", "system", "spawn", "fork");

    private final PatternEngine patternEngine;

    public RuleValidator(PatternEngine patternEngine) {
        this.patternEngine = patternEngine;
    }

    public List<ValidationWarning> validate(List<NormalizedRule> rules) {
        List<ValidationWarning> warnings = new ArrayList<>();
        for (NormalizedRule rule : rules) {
            validateRule(rule, warnings);
        }
        return warnings;
    }

    private void validateRule(NormalizedRule rule, List<ValidationWarning> warnings) {
        String pattern = rule.original();
        String category = rule.category().key();

        if (pattern.trim().isEmpty()) {
            warnings.add(warning(ValidationWarningType.INVALID_PATTERN,
                    "Empty rule pattern in " + category + " rules", rule));
            return;
        }

        if (PatternAnalyzer.matchesEverything(pattern)) {
            warnings.add(warning(ValidationWarningType.BEST_PRACTICE_VIOLATION,
                    String.format("Overly broad pattern \"%s\" in %s rules", pattern, category), rule));
        }

        if (rule.kind() == PatternKind.REGEX && patternEngine.compile(pattern).literalFallback()) {
            warnings.add(warning(ValidationWarningType.INVALID_PATTERN,
                    "Invalid regex pattern: " + pattern, rule));
        }

        if (rule.category() == RuleCategory.ALLOW && isDangerous(pattern)) {
            warnings.add(warning(ValidationWarningType.BEST_PRACTICE_VIOLATION,
                    "Potentially dangerous pattern in allow rules: " + pattern, rule));
        }
    }

    static boolean isDangerous(String pattern) {
        String lower = pattern.toLowerCase(Locale.ROOT);
        for (String token : DANGEROUS_TOKENS) {
            if (lower.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static ValidationWarning warning(ValidationWarningType type, String message, NormalizedRule rule) {
        return new ValidationWarning(type, message, rule.location(), Map.of("rule", rule.original()));
    }
}
