/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.SecurityAnalysis;
import com.aegis.permissions.api.model.SecurityIssue;
import com.aegis.permissions.api.model.SecurityIssueType;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.pattern.PatternAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores the security posture of a rule set on a 0-100 scale.
 *
 * <p>Each issue deducts {@link Severity#scorePenalty()} points; the score never drops below zero.
 */
public final class SecurityAnalyzer {

    static final String ZERO_BYPASS_FIX = "Remove or modify the allow/ask rule to not overlap with deny rules";
    static final String OVERLY_BROAD_FIX = "Replace the match-everything pattern with specific permissions";
    static final String WEAK_PATTERN_FIX = "Use more specific patterns to prevent bypasses";
    static final String OVERLY_PERMISSIVE_FIX = "Restrict the pattern to specific necessary permissions";
    static final String MISSING_DENY_FIX = "Add deny rules for dangerous operations";

    private final boolean requireDenyRules;

    public SecurityAnalyzer(boolean requireDenyRules) {
        this.requireDenyRules = requireDenyRules;
    }

    public SecurityAnalysis analyze(List<NormalizedRule> rules, List<Conflict> conflicts) {
        List<SecurityIssue> issues = new ArrayList<>();
        Set<String> bypassVectors = new LinkedHashSet<>();

        for (Conflict conflict : conflicts) {
            if (conflict.kind() == ConflictKind.ALLOW_OVERRIDES_DENY) {
                issues.add(new SecurityIssue(SecurityIssueType.ZERO_BYPASS_VIOLATION, Severity.CRITICAL,
                        conflict.message(), patternsOf(conflict)));
            }
        }

        for (NormalizedRule rule : rules) {
            String pattern = rule.original();
            if (PatternAnalyzer.matchesEverything(pattern)) {
                issues.add(new SecurityIssue(SecurityIssueType.OVERLY_BROAD, Severity.CRITICAL,
                        String.format("Pattern \"%s\" in %s rules matches everything", pattern,
                                rule.category().key()),
                        List.of(pattern)));
            }
            if (rule.category() == RuleCategory.DENY && isWeak(pattern)) {
                issues.add(new SecurityIssue(SecurityIssueType.WEAK_PATTERN, Severity.MEDIUM,
                        String.format("Weak deny pattern detected: \"%s\"", pattern), List.of(pattern)));
                bypassVectors.add(String.format(
                        "Pattern \"%s\" can be bypassed with encoding or path manipulation (%s)",
                        pattern, bypassExample(pattern)));
            }
            if (rule.category() == RuleCategory.ALLOW && isOverlyPermissive(pattern)) {
                issues.add(new SecurityIssue(SecurityIssueType.OVERLY_PERMISSIVE, Severity.MEDIUM,
                        String.format("Overly permissive allow rule: \"%s\"", pattern), List.of(pattern)));
            }
        }

        if (requireDenyRules && rules.stream().noneMatch(r -> r.category() == RuleCategory.DENY)) {
            issues.add(new SecurityIssue(SecurityIssueType.MISSING_DENY, Severity.MEDIUM,
                    "No deny rules defined - security policy is too permissive", List.of()));
        }

        return new SecurityAnalysis(score(issues), issues, new ArrayList<>(bypassVectors),
                recommendations(issues));
    }

    /**
     * Remediation text for an issue type.
     */
    public static String suggestedFix(SecurityIssueType type) {
        switch (type) {
            case ZERO_BYPASS_VIOLATION:
                return ZERO_BYPASS_FIX;
            case OVERLY_BROAD:
                return OVERLY_BROAD_FIX;
            case WEAK_PATTERN:
                return WEAK_PATTERN_FIX;
            case OVERLY_PERMISSIVE:
                return OVERLY_PERMISSIVE_FIX;
            case MISSING_DENY:
                return MISSING_DENY_FIX;
            default:
                throw new IllegalArgumentException("Unknown issue type: " + type);
        }
    }

    static int score(List<SecurityIssue> issues) {
        int score = 100;
        for (SecurityIssue issue : issues) {
            score -= issue.severity().scorePenalty();
        }
        return Math.max(0, score);
    }

    static boolean isWeak(String pattern) {
        return pattern.length() < 3
                || pattern.equals(".")
                || pattern.startsWith("..")
                || (!pattern.contains("/") && pattern.contains("*"));
    }

    static boolean isOverlyPermissive(String pattern) {
        return PatternAnalyzer.matchesEverything(pattern)
                || pattern.equals("**/*")
                || (pattern.startsWith("*") && pattern.length() < 5);
    }

    static String bypassExample(String pattern) {
        if (pattern.startsWith("..")) {
            return "URL encoding: %2e%2e%2f";
        }
        if (pattern.contains("*") && !pattern.contains("/")) {
            return "path traversal: ../" + pattern + "/../../sensitive";
        }
        if (pattern.length() < 3) {
            return "pattern too short, easily matched accidentally";
        }
        return "encoding or path manipulation";
    }

    private static List<String> recommendations(List<SecurityIssue> issues) {
        if (issues.isEmpty()) {
            return List.of("Configuration has strong security posture");
        }
        return List.of(
                "Address critical security issues immediately",
                "Review and test all rule interactions",
                "Consider using more specific patterns");
    }

    private static List<String> patternsOf(Conflict conflict) {
        return conflict.conflictingRules().stream()
                .map(ConflictingRule::pattern)
                .collect(Collectors.toList());
    }
}
