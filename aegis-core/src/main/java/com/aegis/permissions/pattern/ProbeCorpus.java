/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PatternKind;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Generates the bounded set of candidate inputs used to compare two patterns.
 *
 * <p>The corpus holds, in order and without duplicates: cases derived from each pattern,
 * encoded variants of each pattern, common file names, common paths, security probes and
 * any caller-supplied extra probes. It is a sample, so overlap verdicts built on it are
 * heuristic.
 */
public final class ProbeCorpus {

    static final List<String> STANDARD_FILES = List.of(
            "file.txt", "script.js", "index.html", "style.css", "config.json",
            "package.json", ".env", ".gitignore", "README.md", "test.spec.js");

    static final List<String> PATHS = List.of(
            "src/index.js",
            "dist/bundle.js",
            "node_modules/package/index.js",
            "../parent/file.txt",
            "../../grandparent/file.txt",
            "./current/file.txt",
            "/absolute/path/file.txt",
            "relative/path/file.txt");

    static final List<String> SECURITY_PROBES = List.of(
            "../../../etc/passwd",
            "..\\..\\..\\windows\\system32\\cmd.exe",
            "file.txt; rm -rf /",
            "file.txt && echo hacked",
            "file.txt | cat /etc/passwd",
            "file.txt\u0000.jpg",
            "file.txt%00.jpg",
            "%2e%2e%2f%2e%2e%2f%2e%2e%2fetc%2fpasswd");

    private static final Escaper URL_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
    private static final String DIVISION_SLASH = "∕";

    private ProbeCorpus() {
    }

    /**
     * Builds the corpus for comparing two rules.
     */
    public static List<String> generate(NormalizedRule ruleA, NormalizedRule ruleB, Collection<String> extraProbes) {
        Set<String> cases = new LinkedHashSet<>();
        cases.addAll(patternCases(ruleA));
        cases.addAll(patternCases(ruleB));
        cases.addAll(encodedVariants(ruleA.original()));
        cases.addAll(encodedVariants(ruleB.original()));
        cases.addAll(STANDARD_FILES);
        cases.addAll(PATHS);
        cases.addAll(SECURITY_PROBES);
        for (String probe : extraProbes) {
            if (probe != null) {
                cases.add(probe);
            }
        }
        return List.copyOf(cases);
    }

    /**
     * Inputs derived from the pattern text: the text itself, wildcard substitutions for globs,
     * decorated forms for literals.
     */
    public static List<String> patternCases(NormalizedRule rule) {
        String pattern = rule.original();
        List<String> cases = new ArrayList<>();
        cases.add(pattern);
        if (rule.kind() == PatternKind.GLOB) {
            cases.add(pattern.replace("*", "test"));
            cases.add(pattern.replace("*", ""));
            cases.add(pattern.replace("*", "a/b/c"));
            cases.add(pattern.replace("?", "x"));
        } else if (rule.kind() == PatternKind.LITERAL) {
            cases.add(pattern + ".txt");
            cases.add("prefix-" + pattern);
            cases.add(pattern + "-suffix");
            cases.add(pattern.toUpperCase(Locale.ROOT));
            cases.add(pattern.toLowerCase(Locale.ROOT));
        }
        return cases;
    }

    /**
     * URL-encoded, separator-encoded, look-alike-separator and double-encoded forms of a pattern.
     * Empty when the pattern has nothing worth encoding.
     */
    public static List<String> encodedVariants(String pattern) {
        if (pattern.indexOf('/') < 0 && pattern.indexOf('.') < 0) {
            return List.of();
        }
        String encoded = percentEncode(pattern);
        return List.of(
                encoded,
                pattern.replace("/", "%2F"),
                pattern.replace(".", "%2E"),
                pattern.replace("/", DIVISION_SLASH),
                percentEncode(encoded));
    }

    static String percentEncode(String text) {
        return URL_ESCAPER.escape(text);
    }
}
