/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.OverlapDetector;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.Overlap;
import com.aegis.permissions.api.model.OverlapKind;
import com.aegis.permissions.api.model.PatternKind;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Overlap detection by evaluating both rules against a generated probe corpus.
 *
 * <p>Classification over the corpus:
 * <ul>
 *   <li>no input matched by both : {@link OverlapKind#NONE}</li>
 *   <li>every input matched by both : {@link OverlapKind#EXACT}</li>
 *   <li>no input matched by A alone : {@link OverlapKind#SUBSET}</li>
 *   <li>no input matched by B alone : {@link OverlapKind#SUPERSET}</li>
 *   <li>otherwise : {@link OverlapKind#PARTIAL}</li>
 * </ul>
 *
 * <p>Before consulting the corpus, three shortcuts give the same verdict at lower cost:
 * identical normalized forms are exact; two globs or literals whose fixed prefixes or
 * suffixes are incompatible share no input; and a literal shares inputs with the other
 * rule only if the other rule matches the literal's own text.
 */
public final class CorpusOverlapDetector implements OverlapDetector {

    private static final double COMPLEXITY_DISCOUNT_THRESHOLD = 50;
    private static final double COMPLEXITY_DISCOUNT = 0.8;

    private final PatternAnalyzer analyzer;
    private final Cache<VerdictKey, Verdict> verdictCache;

    public CorpusOverlapDetector(PatternAnalyzer analyzer) {
        this(analyzer, 50_000);
    }

    public CorpusOverlapDetector(PatternAnalyzer analyzer, int cacheSize) {
        this.analyzer = analyzer;
        this.verdictCache = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    @Override
    public Overlap analyzeOverlap(NormalizedRule ruleA, NormalizedRule ruleB, Collection<String> extraProbes) {
        if (ruleA.kind() == ruleB.kind() && ruleA.normalizedForm().equals(ruleB.normalizedForm())) {
            return exact(ruleA, ruleB);
        }
        if (ruleA.kind() == PatternKind.LITERAL && ruleB.kind() == PatternKind.LITERAL) {
            // Distinct literals match distinct single inputs.
            return Overlap.none(ruleA, ruleB);
        }
        if (provablyDisjoint(ruleA, ruleB)) {
            return Overlap.none(ruleA, ruleB);
        }
        if (ruleA.kind() == PatternKind.LITERAL && !ruleB.matches(ruleA.original())) {
            return Overlap.none(ruleA, ruleB);
        }
        if (ruleB.kind() == PatternKind.LITERAL && !ruleA.matches(ruleB.original())) {
            return Overlap.none(ruleA, ruleB);
        }

        VerdictKey key = new VerdictKey(ruleA.kind(), ruleA.original(), ruleB.kind(), ruleB.original(),
                List.copyOf(extraProbes));
        Verdict verdict = verdictCache.get(key, k -> evaluate(ruleA, ruleB, extraProbes));
        return new Overlap(ruleA, ruleB, verdict.kind(), verdict.examples(), verdict.confidence(),
                verdict.coveragePercent());
    }

    private Verdict evaluate(NormalizedRule ruleA, NormalizedRule ruleB, Collection<String> extraProbes) {
        List<String> corpus = ProbeCorpus.generate(ruleA, ruleB, extraProbes);
        RoaringBitmap matchedA = new RoaringBitmap();
        RoaringBitmap matchedB = new RoaringBitmap();
        for (int i = 0; i < corpus.size(); i++) {
            String input = corpus.get(i);
            if (ruleA.matches(input)) {
                matchedA.add(i);
            }
            if (ruleB.matches(input)) {
                matchedB.add(i);
            }
        }

        RoaringBitmap both = RoaringBitmap.and(matchedA, matchedB);
        int bothCount = both.getCardinality();
        if (bothCount == 0) {
            return Verdict.NONE;
        }
        int onlyA = RoaringBitmap.andNot(matchedA, matchedB).getCardinality();
        int onlyB = RoaringBitmap.andNot(matchedB, matchedA).getCardinality();

        OverlapKind kind;
        if (bothCount == corpus.size()) {
            kind = OverlapKind.EXACT;
        } else if (onlyA == 0) {
            kind = OverlapKind.SUBSET;
        } else if (onlyB == 0) {
            kind = OverlapKind.SUPERSET;
        } else {
            kind = OverlapKind.PARTIAL;
        }

        List<String> examples = new ArrayList<>(Overlap.MAX_EXAMPLES);
        both.forEach((int index) -> {
            if (examples.size() < Overlap.MAX_EXAMPLES) {
                examples.add(corpus.get(index));
            }
        });

        double share = (double) bothCount / corpus.size() * 100;
        double confidence = share;
        if (analyzer.calculateComplexity(ruleA) > COMPLEXITY_DISCOUNT_THRESHOLD
                || analyzer.calculateComplexity(ruleB) > COMPLEXITY_DISCOUNT_THRESHOLD) {
            confidence *= COMPLEXITY_DISCOUNT;
        }
        return new Verdict(kind, examples, clamp(confidence), share);
    }

    private static Overlap exact(NormalizedRule ruleA, NormalizedRule ruleB) {
        List<String> examples = new ArrayList<>(Overlap.MAX_EXAMPLES);
        for (String candidate : ProbeCorpus.patternCases(ruleA)) {
            if (examples.size() == Overlap.MAX_EXAMPLES) {
                break;
            }
            if (ruleA.matches(candidate) && !examples.contains(candidate)) {
                examples.add(candidate);
            }
        }
        return new Overlap(ruleA, ruleB, OverlapKind.EXACT, examples, 100.0, 100.0);
    }

    /**
     * Sound disjointness test for literals and globs. Every input of a glob starts with the text
     * before its first wildcard and ends with the text after its last one, so two such rules can
     * only share an input when their prefixes and their suffixes are pairwise compatible.
     */
    static boolean provablyDisjoint(NormalizedRule ruleA, NormalizedRule ruleB) {
        String[] a = affixes(ruleA);
        String[] b = affixes(ruleB);
        if (a == null || b == null) {
            return false;
        }
        boolean prefixesCompatible = a[0].startsWith(b[0]) || b[0].startsWith(a[0]);
        boolean suffixesCompatible = a[1].endsWith(b[1]) || b[1].endsWith(a[1]);
        return !(prefixesCompatible && suffixesCompatible);
    }

    /**
     * {prefix, suffix} of the fixed text around the wildcards, or null for regexes.
     */
    private static String[] affixes(NormalizedRule rule) {
        String pattern = rule.original();
        switch (rule.kind()) {
            case LITERAL:
                return new String[]{pattern, pattern};
            case GLOB: {
                int first = firstWildcard(pattern);
                int last = lastWildcard(pattern);
                if (first < 0) {
                    // '[' only: compiled as literal text
                    return new String[]{pattern, pattern};
                }
                return new String[]{pattern.substring(0, first), pattern.substring(last + 1)};
            }
            default:
                return null;
        }
    }

    private static int firstWildcard(String pattern) {
        int star = pattern.indexOf('*');
        int question = pattern.indexOf('?');
        if (star < 0) {
            return question;
        }
        return question < 0 ? star : Math.min(star, question);
    }

    private static int lastWildcard(String pattern) {
        return Math.max(pattern.lastIndexOf('*'), pattern.lastIndexOf('?'));
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(100, value));
    }

    private record VerdictKey(PatternKind kindA, String patternA, PatternKind kindB, String patternB,
                              List<String> extraProbes) {
    }

    private record Verdict(OverlapKind kind, List<String> examples, double confidence, double coveragePercent) {
        static final Verdict NONE = new Verdict(OverlapKind.NONE, List.of(), 0.0, 0.0);
    }
}
