/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.PatternWeakness;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.WeaknessType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores patterns and detects their intrinsic weaknesses.
 *
 * <p>All scores are computed from the original pattern text, except the signature, which is
 * computed from the normalized form. Full analyses are memoized per (category, kind, pattern).
 */
public final class PatternAnalyzer {

    private static final Set<String> MATCH_EVERYTHING = Set.of("*", "**", ".*");
    private static final String SPECIAL_CHARACTERS = "*?[]{}()|\\^$+.";

    private final Cache<String, PatternAnalysis> analysisCache;

    public PatternAnalyzer() {
        this(5_000);
    }

    public PatternAnalyzer(int cacheSize) {
        this.analysisCache = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * True for patterns that match every input: {@code *}, {@code **} and {@code .*}.
     */
    public static boolean matchesEverything(String pattern) {
        return MATCH_EVERYTHING.contains(pattern);
    }

    public PatternAnalysis analyzePattern(NormalizedRule rule) {
        String key = rule.category().key() + "|" + rule.kind() + "|" + rule.original();
        return analysisCache.get(key, k -> {
            double complexity = calculateComplexity(rule);
            return new PatternAnalysis(
                    rule.original(),
                    rule.kind(),
                    complexity,
                    calculateSpecificity(rule),
                    detectWeaknesses(rule),
                    getPatternSignature(rule),
                    estimateCoverage(rule),
                    PerformanceImpact.forComplexity(complexity));
        });
    }

    /**
     * Complexity in [0, 100]: half the length (at most 30), 5 per special character,
     * 10 per group, plus 20 for regexes or 10 for globs.
     */
    public double calculateComplexity(NormalizedRule rule) {
        String pattern = rule.original();
        double complexity = Math.min(pattern.length() / 2.0, 30);
        complexity += count(pattern, SPECIAL_CHARACTERS) * 5;
        complexity += count(pattern, "(") * 10;
        if (rule.kind() == PatternKind.REGEX) {
            complexity += 20;
        } else if (rule.kind() == PatternKind.GLOB) {
            complexity += 10;
        }
        return Math.min(100, complexity);
    }

    /**
     * Specificity in [0, 100]. Wildcards and short length reduce it, literals gain a bonus.
     */
    public int calculateSpecificity(NormalizedRule rule) {
        String pattern = rule.original();
        int specificity = 100;
        specificity -= count(pattern, "*") * 15;
        specificity -= count(pattern, "?") * 10;
        if (pattern.length() < 5) {
            specificity -= 30;
        } else if (pattern.length() < 10) {
            specificity -= 15;
        }
        if (rule.kind() == PatternKind.LITERAL) {
            specificity += 20;
        }
        return clamp(specificity);
    }

    public int estimateCoverage(NormalizedRule rule) {
        String pattern = rule.original();
        if (rule.kind() == PatternKind.LITERAL) {
            return 1;
        }
        if (pattern.equals("*") || pattern.equals("**")) {
            return 100;
        }
        int coverage = 10 + count(pattern, "*") * 20 + count(pattern, "?") * 5;
        return Math.min(100, coverage);
    }

    public PerformanceImpact assessPerformanceImpact(NormalizedRule rule) {
        return PerformanceImpact.forComplexity(calculateComplexity(rule));
    }

    public List<PatternWeakness> detectWeaknesses(NormalizedRule rule) {
        String pattern = rule.original();
        List<PatternWeakness> weaknesses = new ArrayList<>();

        if (matchesEverything(pattern)) {
            weaknesses.add(new PatternWeakness(
                    WeaknessType.TOO_BROAD,
                    Severity.CRITICAL,
                    "Pattern matches everything, providing no security benefit",
                    List.of("any/path", "malicious.exe", "../../etc/passwd"),
                    "Use more specific patterns that match only intended resources"));
        }

        if (pattern.contains("..") || pattern.startsWith(".")) {
            weaknesses.add(new PatternWeakness(
                    WeaknessType.TRAVERSAL_RISK,
                    Severity.HIGH,
                    "Pattern may be vulnerable to path traversal attacks",
                    List.of("../../../etc/passwd", "..\\..\\..\\windows\\system32", "%2e%2e%2f%2e%2e%2f"),
                    "Use absolute paths or validate against path traversal"));
        }

        if (pattern.indexOf('/') < 0 && pattern.indexOf('*') >= 0) {
            weaknesses.add(new PatternWeakness(
                    WeaknessType.ENCODING_VULNERABLE,
                    Severity.MEDIUM,
                    "Pattern may be bypassed with encoding techniques",
                    List.of(ProbeCorpus.percentEncode(pattern), pattern.replace("/", "%2F")),
                    "Include path separators or use more specific patterns"));
        }

        if (pattern.length() < 3 || alphanumericCount(pattern) < 2) {
            weaknesses.add(new PatternWeakness(
                    WeaknessType.TOO_VAGUE,
                    Severity.MEDIUM,
                    "Pattern is too vague and may match unintended inputs",
                    List.of("a", "1", "-"),
                    "Add more specific characters to the pattern"));
        }

        if (rule.category() == RuleCategory.DENY && rule.kind() == PatternKind.GLOB
                && !pattern.startsWith("/") && !pattern.endsWith("$")) {
            weaknesses.add(new PatternWeakness(
                    WeaknessType.ESCAPE_PRONE,
                    Severity.HIGH,
                    "Pattern lacks anchors and may be bypassed",
                    List.of("prefix" + pattern, pattern + "suffix", "../bypass/" + pattern),
                    "Add path anchors or use regex with ^ and $ anchors"));
        }

        return weaknesses;
    }

    /**
     * Coarse grouping key: kind, path and wildcard markers, a short extension hint and a
     * length bucket, all taken from the normalized form.
     */
    public String getPatternSignature(NormalizedRule rule) {
        String pattern = rule.normalizedForm();
        StringBuilder signature = new StringBuilder(rule.kind().name().toLowerCase(Locale.ROOT)).append(':');
        if (pattern.indexOf('/') >= 0) {
            signature.append("path:");
        }
        if (pattern.indexOf('*') >= 0) {
            signature.append("wildcard:");
        }
        int dot = pattern.lastIndexOf('.');
        if (dot >= 0) {
            String extension = pattern.substring(dot + 1);
            if (!extension.isEmpty() && extension.length() <= 4) {
                signature.append("ext:").append(extension).append(':');
            }
        }
        if (pattern.length() < 5) {
            signature.append("short");
        } else if (pattern.length() < 20) {
            signature.append("medium");
        } else {
            signature.append("long");
        }
        return signature.toString();
    }

    /**
     * Inputs an attacker would try against a pattern.
     */
    public List<String> getAttackVectors(String pattern) {
        List<String> vectors = new ArrayList<>();
        if (!pattern.startsWith("/")) {
            vectors.add("Path traversal: ../../../" + pattern);
        }
        String encoded = ProbeCorpus.percentEncode(pattern);
        vectors.add("URL encoding: " + encoded);
        vectors.add("Double encoding: " + ProbeCorpus.percentEncode(encoded));
        vectors.add("Null byte: " + pattern + "%00.safe");
        if (pattern.contains(".sh") || pattern.contains(".exe") || pattern.contains(".bat")) {
            vectors.add("Command injection: " + pattern + " && malicious-command");
        }
        return vectors;
    }

    /**
     * Narrows a pattern so that it matches fewer inputs. Returns the input unchanged when no
     * narrowing applies.
     */
    public String makeMoreSpecific(String pattern) {
        if (pattern.equals("*")) {
            return "*.js";
        }
        if (pattern.equals("**")) {
            return "src/**";
        }
        if (pattern.startsWith("*")) {
            return "specific/" + pattern;
        }
        if (pattern.endsWith("*")) {
            return pattern.substring(0, pattern.length() - 1) + ".js";
        }
        if (pattern.indexOf('/') < 0) {
            return "src/" + pattern;
        }
        return pattern;
    }

    public void clearCache() {
        analysisCache.invalidateAll();
    }

    static int count(String text, String characters) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (characters.indexOf(text.charAt(i)) >= 0) {
                n++;
            }
        }
        return n;
    }

    private static int alphanumericCount(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                n++;
            }
        }
        return n;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
