/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.OverlapDetector;
import com.aegis.permissions.api.exception.ValidationException;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.Overlap;
import com.aegis.permissions.api.model.OverlapKind;
import com.aegis.permissions.api.model.PatternWeakness;
import com.aegis.permissions.api.model.ResolutionStrategy;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.pattern.PatternAnalyzer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Detects conflicts in a normalized rule set.
 *
 * <h2>Passes</h2>
 * <ol>
 *   <li><b>Zero-bypass</b>: every deny rule against every allow and ask rule. Any overlap is an
 *       {@link ConflictKind#ALLOW_OVERRIDES_DENY} conflict. The pair is then <i>claimed</i>.</li>
 *   <li><b>Precedence ambiguity</b>: rules grouped by pattern signature. A group spanning several
 *       categories is reported when it holds at least one unclaimed cross-category pair that overlaps.</li>
 *   <li><b>Overlapping patterns</b>: every pair {@code i < j}, sharded across workers above the
 *       parallel threshold. Cross-category overlaps, same-category exact overlaps and deny
 *       subset/superset overlaps are reported.</li>
 *   <li><b>Contradictory rules</b>: unclaimed cross-category pairs whose overlap is neither
 *       partial nor empty with confidence above 70.</li>
 *   <li><b>Weaknesses</b>: critical pattern weaknesses always, others under deep analysis.</li>
 * </ol>
 *
 * <p>Results are deduplicated by (kind, sorted patterns), keeping the first occurrence, then
 * stably sorted most severe first. Only pass 1 runs in zero-bypass-only mode.
 *
 * <p>Results are cached per rule-set content. Thread-safe; the engine owns a fixed worker
 * pool and must be closed.
 */
public final class ConflictDetectionEngine implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ConflictDetectionEngine.class.getName());

    private static final double CONTRADICTION_CONFIDENCE_THRESHOLD = 70;
    private static final int MESSAGE_EXAMPLES = 3;

    private final OverlapDetector overlapDetector;
    private final PatternAnalyzer patternAnalyzer;
    private final ConflictDetectionConfig config;
    private final Cache<String, ConflictDetectionResult> detectionCache;
    private final ExecutorService workers;

    public ConflictDetectionEngine(OverlapDetector overlapDetector, PatternAnalyzer patternAnalyzer) {
        this(overlapDetector, patternAnalyzer, ConflictDetectionConfig.defaults());
    }

    public ConflictDetectionEngine(OverlapDetector overlapDetector,
                                   PatternAnalyzer patternAnalyzer,
                                   ConflictDetectionConfig config) {
        this.overlapDetector = overlapDetector;
        this.patternAnalyzer = patternAnalyzer;
        this.config = config;
        this.detectionCache = Caffeine.newBuilder()
                .maximumSize(config.getDetectionCacheSize())
                .build();
        this.workers = Executors.newFixedThreadPool(
                config.getWorkerCount(),
                new ThreadFactoryBuilder()
                        .setNameFormat("aegis-conflict-worker-%d")
                        .setDaemon(true)
                        .build());
    }

    public ConflictDetectionResult detectConflicts(List<NormalizedRule> rules) {
        return detectConflicts(rules, DetectionOptions.defaults());
    }

    public ConflictDetectionResult detectConflicts(List<NormalizedRule> rules, DetectionOptions options) {
        long start = System.nanoTime();
        boolean deep = config.isDeepAnalysis() || options.deepAnalysis();
        String cacheKey = cacheKey(rules, options, deep);

        if (!options.skipCache()) {
            ConflictDetectionResult cached = detectionCache.getIfPresent(cacheKey);
            if (cached != null) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Conflict detection cache hit - %d conflicts",
                            cached.conflicts().size()));
                }
                return cached.asCached();
            }
        }

        List<Conflict> conflicts = new ArrayList<>();
        List<Overlap> overlaps = new ArrayList<>();
        LongSet claimed = new LongOpenHashSet();
        long pairsAnalyzed = detectZeroBypassViolations(rules, options.extraProbes(), conflicts, overlaps, claimed);

        if (!options.zeroBypassOnly()) {
            PairwiseScan scan = scanPairs(rules, options);
            pairsAnalyzed += scan.pairsAnalyzed();

            conflicts.addAll(detectPrecedenceAmbiguities(rules, scan, claimed));
            for (IndexedOverlap indexed : scan.overlaps()) {
                overlaps.add(indexed.overlap());
                NormalizedRule rule1 = rules.get(indexed.first());
                NormalizedRule rule2 = rules.get(indexed.second());
                if (isSignificantOverlap(indexed.overlap(), rule1, rule2)) {
                    conflicts.add(createOverlapConflict(rule1, rule2, indexed.overlap()));
                }
            }
            conflicts.addAll(detectContradictoryRules(rules, scan, claimed));
            conflicts.addAll(detectSecurityWeaknesses(rules, deep));
        }

        List<Conflict> sorted = sortBySeverity(deduplicate(conflicts));
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        ConflictDetectionResult result = new ConflictDetectionResult(sorted, overlaps, pairsAnalyzed, elapsedMs, false);

        if (!options.skipCache()) {
            detectionCache.put(cacheKey, result);
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Detected %d conflicts across %d rules (%d pairs) in %.2f ms",
                    sorted.size(), rules.size(), pairsAnalyzed, elapsedMs));
        }
        return result;
    }

    /**
     * Detailed analysis of one conflict, running detection over {@code rules} to find related conflicts.
     */
    public DetailedConflictAnalysis analyzeConflict(Conflict conflict, List<NormalizedRule> rules) {
        return analyzeConflict(conflict, rules, detectConflicts(rules).conflicts());
    }

    /**
     * Detailed analysis of one conflict within its rule set.
     *
     * @param allConflicts the complete detection output, used to find related conflicts
     */
    public DetailedConflictAnalysis analyzeConflict(Conflict conflict,
                                                    List<NormalizedRule> rules,
                                                    List<Conflict> allConflicts) {
        List<NormalizedRule> involved = new ArrayList<>();
        for (ConflictingRule conflicting : conflict.conflictingRules()) {
            rules.stream()
                    .filter(r -> r.category() == conflicting.category() && r.original().equals(conflicting.pattern()))
                    .findFirst()
                    .ifPresent(involved::add);
        }

        List<String> attackVectors = new ArrayList<>();
        if (conflict.kind() == ConflictKind.ALLOW_OVERRIDES_DENY) {
            attackVectors.add("Direct bypass: inputs matched by the deny rule are granted by a lower-precedence rule");
        }
        for (ConflictingRule conflicting : conflict.conflictingRules()) {
            if (conflicting.category() == RuleCategory.DENY) {
                attackVectors.addAll(patternAnalyzer.getAttackVectors(conflicting.pattern()));
            }
        }

        double confidence = 100.0;
        if (involved.size() == 2) {
            Overlap overlap = overlapDetector.analyzeOverlap(involved.get(0), involved.get(1));
            confidence = overlap.overlaps() ? Math.max(overlap.confidence(), 1.0) : 0.0;
        }

        Set<String> patterns = conflict.conflictingRules().stream()
                .map(ConflictingRule::pattern)
                .collect(Collectors.toSet());
        List<String> related = allConflicts.stream()
                .filter(other -> !other.equals(conflict))
                .filter(other -> other.conflictingRules().stream().anyMatch(r -> patterns.contains(r.pattern())))
                .map(Conflict::message)
                .collect(Collectors.toList());

        return new DetailedConflictAnalysis(conflict, attackVectors, resolutionOptions(conflict), confidence, related);
    }

    public void clearCache() {
        detectionCache.invalidateAll();
    }

    public long cachedResultCount() {
        return detectionCache.estimatedSize();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            logger.warning("Conflict worker shutdown interrupted");
        }
    }

    // ---- pass 1 ---------------------------------------------------------------------------

    private long detectZeroBypassViolations(List<NormalizedRule> rules,
                                            List<String> probes,
                                            List<Conflict> conflicts,
                                            List<Overlap> overlaps,
                                            LongSet claimed) {
        List<Integer> denies = new ArrayList<>();
        List<Integer> permissive = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).category() == RuleCategory.DENY) {
                denies.add(i);
            }
        }
        // allow rules are checked before ask rules
        for (RuleCategory category : List.of(RuleCategory.ALLOW, RuleCategory.ASK)) {
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).category() == category) {
                    permissive.add(i);
                }
            }
        }

        for (int d : denies) {
            NormalizedRule deny = rules.get(d);
            for (int p : permissive) {
                NormalizedRule other = rules.get(p);
                Overlap overlap = overlapDetector.analyzeOverlap(other, deny, probes);
                if (overlap.overlaps()) {
                    overlaps.add(overlap);
                    conflicts.add(createZeroBypassConflict(deny, other, overlap));
                    claimed.add(pairKey(d, p, rules.size()));
                }
            }
        }
        return (long) denies.size() * permissive.size();
    }

    private Conflict createZeroBypassConflict(NormalizedRule deny, NormalizedRule other, Overlap overlap) {
        String category = other.category() == RuleCategory.ALLOW ? "Allow" : "Ask";
        String examples = overlap.exampleInputs().stream()
                .limit(MESSAGE_EXAMPLES)
                .collect(Collectors.joining(", "));
        String message = String.format(
                "CRITICAL SECURITY VIOLATION: %s rule \"%s\" %s deny rule \"%s\". "
                        + "This creates a potential bypass vector where denied operations could be permitted. "
                        + "Examples of affected patterns: %s",
                category, other.original(), overlap.kind().phrase(), deny.original(), examples);
        return new Conflict(
                ConflictKind.ALLOW_OVERRIDES_DENY,
                message,
                List.of(ConflictingRule.of(deny), ConflictingRule.of(other)),
                zeroBypassResolution(overlap.kind()),
                other.category() == RuleCategory.ALLOW ? Severity.CRITICAL : Severity.HIGH);
    }

    private static ResolutionStrategy zeroBypassResolution(OverlapKind kind) {
        switch (kind) {
            case EXACT:
                return ResolutionStrategy.REMOVE_CONFLICTING_RULE;
            case SUPERSET:
                return ResolutionStrategy.MAKE_ALLOW_MORE_RESTRICTIVE;
            case SUBSET:
                return ResolutionStrategy.MAKE_DENY_MORE_SPECIFIC;
            default:
                return ResolutionStrategy.MANUAL_REVIEW_REQUIRED;
        }
    }

    // ---- pass 2 ---------------------------------------------------------------------------

    private List<Conflict> detectPrecedenceAmbiguities(List<NormalizedRule> rules, PairwiseScan scan, LongSet claimed) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            groups.computeIfAbsent(patternAnalyzer.getPatternSignature(rules.get(i)), k -> new ArrayList<>()).add(i);
        }

        List<Conflict> conflicts = new ArrayList<>();
        for (List<Integer> group : groups.values()) {
            if (group.size() < 2 || categoriesOf(rules, group).size() < 2) {
                continue;
            }
            if (hasUnclaimedCrossCategoryOverlap(rules, group, scan, claimed)) {
                List<NormalizedRule> members = group.stream().map(rules::get).collect(Collectors.toList());
                boolean hasDeny = members.stream().anyMatch(r -> r.category() == RuleCategory.DENY);
                conflicts.add(new Conflict(
                        ConflictKind.PRECEDENCE_AMBIGUITY,
                        "Ambiguous precedence for pattern group: "
                                + members.stream().map(NormalizedRule::original).collect(Collectors.joining(", ")),
                        members.stream().map(ConflictingRule::of).collect(Collectors.toList()),
                        ResolutionStrategy.MAKE_DENY_MORE_SPECIFIC,
                        hasDeny ? Severity.HIGH : Severity.MEDIUM));
            }
        }
        return conflicts;
    }

    private static boolean hasUnclaimedCrossCategoryOverlap(List<NormalizedRule> rules,
                                                            List<Integer> group,
                                                            PairwiseScan scan,
                                                            LongSet claimed) {
        int n = rules.size();
        for (int a = 0; a < group.size(); a++) {
            for (int b = a + 1; b < group.size(); b++) {
                int i = group.get(a);
                int j = group.get(b);
                if (rules.get(i).category() == rules.get(j).category()) {
                    continue;
                }
                long key = pairKey(i, j, n);
                if (!claimed.contains(key) && scan.overlapsByPair().containsKey(key)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ---- pass 3 ---------------------------------------------------------------------------

    private PairwiseScan scanPairs(List<NormalizedRule> rules, DetectionOptions options) {
        int n = rules.size();
        long pairs = (long) n * (n - 1) / 2;
        int shards = options.workerCount() > 0 ? options.workerCount() : config.getWorkerCount();
        boolean parallel = config.isParallel() && options.parallel()
                && n > config.getParallelThreshold() && shards > 1;

        List<IndexedOverlap> found;
        if (!parallel) {
            found = scanShard(rules, 0, 1, options.extraProbes());
        } else {
            found = scanInParallel(rules, shards, options.extraProbes());
        }

        Long2ObjectMap<Overlap> byPair = new Long2ObjectOpenHashMap<>(found.size());
        for (IndexedOverlap indexed : found) {
            byPair.put(pairKey(indexed.first(), indexed.second(), n), indexed.overlap());
        }
        return new PairwiseScan(found, byPair, pairs);
    }

    private List<IndexedOverlap> scanInParallel(List<NormalizedRule> rules, int shards, List<String> probes) {
        List<Future<List<IndexedOverlap>>> futures = new ArrayList<>(shards);
        for (int shard = 0; shard < shards; shard++) {
            final int offset = shard;
            futures.add(workers.submit(() -> scanShard(rules, offset, shards, probes)));
        }

        List<IndexedOverlap> merged = new ArrayList<>();
        try {
            for (Future<List<IndexedOverlap>> future : futures) {
                merged.addAll(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new ValidationException("Conflict detection interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new ValidationException("Conflict detection worker failed: " + e.getCause().getMessage(),
                    e.getCause());
        }

        // restore the sequential (i, j) order so results do not depend on scheduling
        merged.sort(Comparator.comparingInt(IndexedOverlap::first).thenComparingInt(IndexedOverlap::second));
        return merged;
    }

    /**
     * Scans rows {@code offset, offset + stride, ...}. Striding balances the triangular workload.
     */
    private List<IndexedOverlap> scanShard(List<NormalizedRule> rules, int offset, int stride, List<String> probes) {
        List<IndexedOverlap> found = new ArrayList<>();
        int n = rules.size();
        for (int i = offset; i < n; i += stride) {
            NormalizedRule rule1 = rules.get(i);
            for (int j = i + 1; j < n; j++) {
                Overlap overlap = overlapDetector.analyzeOverlap(rule1, rules.get(j), probes);
                if (overlap.overlaps()) {
                    found.add(new IndexedOverlap(i, j, overlap));
                }
            }
        }
        return found;
    }

    private static boolean isSignificantOverlap(Overlap overlap, NormalizedRule rule1, NormalizedRule rule2) {
        if (rule1.category() != rule2.category()) {
            return true;
        }
        if (overlap.kind() == OverlapKind.EXACT) {
            return true;
        }
        return (overlap.kind() == OverlapKind.SUBSET || overlap.kind() == OverlapKind.SUPERSET)
                && rule1.category() == RuleCategory.DENY;
    }

    private static Conflict createOverlapConflict(NormalizedRule rule1, NormalizedRule rule2, Overlap overlap) {
        boolean crossCategory = rule1.category() != rule2.category();
        boolean involvesDeny = rule1.category() == RuleCategory.DENY || rule2.category() == RuleCategory.DENY;

        ConflictKind kind;
        if (crossCategory) {
            kind = involvesDeny ? ConflictKind.ALLOW_OVERRIDES_DENY : ConflictKind.CONTRADICTORY_RULES;
        } else if (overlap.kind() == OverlapKind.EXACT) {
            kind = ConflictKind.OVERLAPPING_PATTERNS;
        } else {
            kind = ConflictKind.PRECEDENCE_AMBIGUITY;
        }

        Severity impact;
        if (crossCategory && involvesDeny) {
            impact = Severity.CRITICAL;
        } else if (crossCategory) {
            impact = Severity.HIGH;
        } else if (overlap.kind() != OverlapKind.PARTIAL) {
            impact = Severity.MEDIUM;
        } else {
            impact = Severity.LOW;
        }

        ResolutionStrategy resolution;
        if (overlap.kind() == OverlapKind.EXACT && !crossCategory) {
            resolution = ResolutionStrategy.REMOVE_CONFLICTING_RULE;
        } else if (involvesDeny) {
            resolution = ResolutionStrategy.MAKE_ALLOW_MORE_RESTRICTIVE;
        } else {
            resolution = ResolutionStrategy.MANUAL_REVIEW_REQUIRED;
        }

        String consequence = crossCategory
                ? "This creates conflicting security policies."
                : "This creates redundancy or ambiguity in rule evaluation.";
        String message = String.format("%s rule \"%s\" %s %s rule \"%s\". %s",
                rule1.category().key(), rule1.original(), overlap.kind().phrase(),
                rule2.category().key(), rule2.original(), consequence);

        return new Conflict(kind, message,
                List.of(ConflictingRule.of(rule1), ConflictingRule.of(rule2)), resolution, impact);
    }

    // ---- pass 4 ---------------------------------------------------------------------------

    private static List<Conflict> detectContradictoryRules(List<NormalizedRule> rules, PairwiseScan scan, LongSet claimed) {
        List<Conflict> conflicts = new ArrayList<>();
        int n = rules.size();
        for (IndexedOverlap indexed : scan.overlaps()) {
            NormalizedRule rule1 = rules.get(indexed.first());
            NormalizedRule rule2 = rules.get(indexed.second());
            Overlap overlap = indexed.overlap();
            if (rule1.category() == rule2.category()
                    || claimed.contains(pairKey(indexed.first(), indexed.second(), n))
                    || overlap.kind() == OverlapKind.PARTIAL
                    || overlap.confidence() <= CONTRADICTION_CONFIDENCE_THRESHOLD) {
                continue;
            }
            boolean involvesDeny = rule1.category() == RuleCategory.DENY || rule2.category() == RuleCategory.DENY;
            conflicts.add(new Conflict(
                    ConflictKind.CONTRADICTORY_RULES,
                    String.format("Rules \"%s\" and \"%s\" have contradictory intents", rule1.original(), rule2.original()),
                    List.of(ConflictingRule.of(rule1), ConflictingRule.of(rule2)),
                    ResolutionStrategy.MANUAL_REVIEW_REQUIRED,
                    involvesDeny ? Severity.HIGH : Severity.MEDIUM));
        }
        return conflicts;
    }

    // ---- pass 5 ---------------------------------------------------------------------------

    private List<Conflict> detectSecurityWeaknesses(List<NormalizedRule> rules, boolean deep) {
        List<Conflict> conflicts = new ArrayList<>();
        for (NormalizedRule rule : rules) {
            for (PatternWeakness weakness : patternAnalyzer.detectWeaknesses(rule)) {
                if (!deep && weakness.severity() != Severity.CRITICAL) {
                    continue;
                }
                conflicts.add(new Conflict(
                        ConflictKind.SECURITY_VIOLATION,
                        String.format("Weak pattern \"%s\" (%s): %s", rule.original(),
                                weakness.type().label(), weakness.description()),
                        List.of(ConflictingRule.of(rule)),
                        ResolutionStrategy.MANUAL_REVIEW_REQUIRED,
                        weakness.severity()));
            }
        }
        return conflicts;
    }

    // ---- helpers --------------------------------------------------------------------------

    private static List<Conflict> deduplicate(List<Conflict> conflicts) {
        Map<String, Conflict> unique = new LinkedHashMap<>();
        for (Conflict conflict : conflicts) {
            unique.putIfAbsent(conflict.deduplicationKey(), conflict);
        }
        return new ArrayList<>(unique.values());
    }

    private static List<Conflict> sortBySeverity(List<Conflict> conflicts) {
        // List.sort is stable: equal severities keep pass order
        conflicts.sort(Comparator.comparingInt(c -> c.securityImpact().ordinal()));
        return conflicts;
    }

    private static Set<RuleCategory> categoriesOf(List<NormalizedRule> rules, List<Integer> group) {
        Set<RuleCategory> categories = EnumSet.noneOf(RuleCategory.class);
        group.forEach(i -> categories.add(rules.get(i).category()));
        return categories;
    }

    private static long pairKey(int a, int b, int n) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        return (long) low * n + high;
    }

    private static String cacheKey(List<NormalizedRule> rules, DetectionOptions options, boolean deep) {
        String content = rules.stream()
                .map(NormalizedRule::contentKey)
                .sorted()
                .collect(Collectors.joining("|"));
        return content + "#zb=" + options.zeroBypassOnly() + "#deep=" + deep
                + "#probes=" + String.join("|", options.extraProbes());
    }

    private static List<DetailedConflictAnalysis.ResolutionOption> resolutionOptions(Conflict conflict) {
        List<ResolutionStrategy> strategies = new ArrayList<>();
        strategies.add(conflict.resolutionStrategy());
        for (ResolutionStrategy strategy : ResolutionStrategy.values()) {
            if (!strategies.contains(strategy)) {
                strategies.add(strategy);
            }
        }
        boolean hasPermissiveRule = conflict.involves(RuleCategory.ALLOW) || conflict.involves(RuleCategory.ASK);

        List<DetailedConflictAnalysis.ResolutionOption> options = new ArrayList<>();
        for (ResolutionStrategy strategy : strategies) {
            switch (strategy) {
                case REMOVE_CONFLICTING_RULE:
                    options.add(new DetailedConflictAnalysis.ResolutionOption(strategy,
                            "Remove the less specific non-deny rule", ChangeRisk.MODERATE, hasPermissiveRule));
                    break;
                case MAKE_ALLOW_MORE_RESTRICTIVE:
                    if (hasPermissiveRule) {
                        options.add(new DetailedConflictAnalysis.ResolutionOption(strategy,
                                "Narrow the allow or ask rule until it no longer overlaps the deny rule",
                                ChangeRisk.MODERATE, true));
                    }
                    break;
                case MAKE_DENY_MORE_SPECIFIC:
                    if (conflict.involves(RuleCategory.DENY)) {
                        options.add(new DetailedConflictAnalysis.ResolutionOption(strategy,
                                "Rewrite the deny rule by hand to target the intended inputs",
                                ChangeRisk.RISKY, false));
                    }
                    break;
                case MANUAL_REVIEW_REQUIRED:
                default:
                    options.add(new DetailedConflictAnalysis.ResolutionOption(strategy,
                            "Review the rules and decide the intended precedence", ChangeRisk.SAFE, false));
                    break;
            }
        }
        return options;
    }

    private record IndexedOverlap(int first, int second, Overlap overlap) {
    }

    private record PairwiseScan(List<IndexedOverlap> overlaps, Long2ObjectMap<Overlap> overlapsByPair,
                                long pairsAnalyzed) {
    }
}
