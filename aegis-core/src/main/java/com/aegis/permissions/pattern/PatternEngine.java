/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.RuleCategory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies, compiles and matches rule patterns.
 *
 * <p>Classification:
 * <ul>
 *   <li>contains {@code *}, {@code ?} or {@code [} : glob</li>
 *   <li>otherwise contains {@code \}, {@code ^}, {@code $}, {@code (} or {@code |} : regex</li>
 *   <li>otherwise : literal</li>
 * </ul>
 *
 * <p>Globs compile to anchored regular expressions with all other metacharacters escaped.
 * Compilation never throws: a malformed regex is compiled as the escaped literal of its text.
 * Compiled patterns and individual match results are memoized in bounded Caffeine caches.
 * Thread-safe.
 */
public final class PatternEngine {

    private static final Logger logger = Logger.getLogger(PatternEngine.class.getName());

    private static final String GLOB_MARKERS = "*?[";
    private static final String REGEX_MARKERS = "\\^$(|";
    private static final String GLOB_ESCAPED = ".+^${}()|[]\\";
    private static final String REGEX_METACHARACTERS = ".*+?^${}()|[]\\";

    private static final int DEFAULT_COMPILED_CACHE_SIZE = 10_000;
    private static final int DEFAULT_MATCH_CACHE_SIZE = 100_000;

    private final Cache<String, CompiledPattern> compiledCache;
    private final Cache<MatchKey, Boolean> matchCache;

    public PatternEngine() {
        this(DEFAULT_COMPILED_CACHE_SIZE, DEFAULT_MATCH_CACHE_SIZE);
    }

    public PatternEngine(int compiledCacheSize, int matchCacheSize) {
        this.compiledCache = Caffeine.newBuilder()
                .maximumSize(compiledCacheSize)
                .recordStats()
                .build();
        this.matchCache = Caffeine.newBuilder()
                .maximumSize(matchCacheSize)
                .build();
    }

    public static PatternKind classify(String pattern) {
        if (containsAny(pattern, GLOB_MARKERS)) {
            return PatternKind.GLOB;
        }
        if (containsAny(pattern, REGEX_MARKERS)) {
            return PatternKind.REGEX;
        }
        return PatternKind.LITERAL;
    }

    /**
     * Compiles a pattern, reusing a previous compilation of the same text.
     */
    public CompiledPattern compile(String pattern) {
        return compiledCache.get(pattern, PatternEngine::doCompile);
    }

    /**
     * Builds the normalized form of a configured rule.
     *
     * @param index position of the rule inside its category list
     */
    public NormalizedRule normalize(String pattern, RuleCategory category, int index) {
        CompiledPattern compiled = compile(pattern);
        return new NormalizedRule(
                pattern,
                compiled.normalizedForm(),
                compiled.kind(),
                compiled.pattern(),
                category,
                category.priorityBase() + index,
                index);
    }

    /**
     * Tests one input against a pattern. Results are memoized per (kind, pattern, input).
     */
    public boolean matches(String pattern, String input) {
        CompiledPattern compiled = compile(pattern);
        return matchCache.get(new MatchKey(compiled.kind(), pattern, input), key -> {
            if (compiled.kind() == PatternKind.LITERAL) {
                return pattern.equals(input);
            }
            return compiled.pattern().matcher(input).find();
        });
    }

    /**
     * Converts a glob to an anchored regular expression: metacharacters escaped,
     * {@code *} to {@code .*}, {@code ?} to {@code .}.
     */
    public static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8).append('^');
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                // "**" collapses to a single ".*"
                if (i == 0 || glob.charAt(i - 1) != '*') {
                    regex.append(".*");
                }
            } else if (c == '?') {
                regex.append('.');
            } else {
                if (GLOB_ESCAPED.indexOf(c) >= 0) {
                    regex.append('\\');
                }
                regex.append(c);
            }
        }
        return regex.append('$').toString();
    }

    public static String escapeRegex(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    public long compiledPatternCount() {
        return compiledCache.estimatedSize();
    }

    public void clearCaches() {
        compiledCache.invalidateAll();
        matchCache.invalidateAll();
    }

    private static CompiledPattern doCompile(String pattern) {
        PatternKind kind = classify(pattern);
        switch (kind) {
            case GLOB: {
                String regex = globToRegex(pattern);
                return new CompiledPattern(kind, regex, Pattern.compile(regex), false);
            }
            case REGEX:
                try {
                    return new CompiledPattern(kind, pattern, Pattern.compile(pattern), false);
                } catch (PatternSyntaxException e) {
                    if (logger.isLoggable(Level.FINE)) {
                        logger.fine(String.format("Malformed regex '%s' compiled as literal: %s",
                                pattern, e.getDescription()));
                    }
                    String escaped = escapeRegex(pattern);
                    return new CompiledPattern(kind, escaped, Pattern.compile("^" + escaped + "$"), true);
                }
            case LITERAL:
            default:
                return new CompiledPattern(kind, pattern, Pattern.compile(Pattern.quote(pattern)), false);
        }
    }

    private static boolean containsAny(String text, String characters) {
        for (int i = 0; i < text.length(); i++) {
            if (characters.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private record MatchKey(PatternKind kind, String pattern, String input) {
    }
}
