/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.OverlapDetector;
import com.aegis.permissions.api.model.AutoFix;
import com.aegis.permissions.api.model.Change;
import com.aegis.permissions.api.model.ChangeAction;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ResolutionStrategy;
import com.aegis.permissions.api.model.ResolutionSuggestion;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.SecurityLevel;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.SuggestionKind;
import com.aegis.permissions.pattern.PatternEngine;
import com.aegis.permissions.pattern.RuleNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.base.CharMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Maps conflicts to resolution suggestions and applies automatic fixes.
 *
 * <p>Every conflict kind has an ordered strategy list. The first strategy that yields a suggestion
 * wins. Restrictions of allow and ask rules are only surfaced once the rewritten pattern is
 * verified not to overlap any deny rule. Deny rules are never changed automatically: strategies
 * that would touch one produce warning guidance without an auto-fix.
 */
public final class ResolutionEngine {

    private static final Logger logger = Logger.getLogger(ResolutionEngine.class.getName());

    private static final int PERMISSIVE_SUGGESTION_CAP = 10;
    private static final CharMatcher STAR = CharMatcher.is('*');
    private static final CharMatcher QUESTION = CharMatcher.is('?');
    private static final CharMatcher SLASH = CharMatcher.is('/');

    private final OverlapDetector overlapDetector;
    private final PatternEngine patternEngine;
    private final RuleNormalizer ruleNormalizer;
    private final ConflictDetectionEngine detectionEngine;
    private final Cache<String, List<ResolutionSuggestion>> resolutionCache;

    public ResolutionEngine(OverlapDetector overlapDetector,
                            PatternEngine patternEngine,
                            ConflictDetectionEngine detectionEngine) {
        this(overlapDetector, patternEngine, detectionEngine, 1_000);
    }

    public ResolutionEngine(OverlapDetector overlapDetector,
                            PatternEngine patternEngine,
                            ConflictDetectionEngine detectionEngine,
                            int cacheSize) {
        this.overlapDetector = overlapDetector;
        this.patternEngine = patternEngine;
        this.ruleNormalizer = new RuleNormalizer(patternEngine);
        this.detectionEngine = detectionEngine;
        this.resolutionCache = Caffeine.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * Resolves every conflict in the context and returns the optimized suggestion list.
     */
    public List<ResolutionSuggestion> generateResolutions(ResolutionContext context) {
        List<ResolutionSuggestion> suggestions = new ArrayList<>();
        for (Conflict conflict : context.conflicts()) {
            resolveConflict(conflict, context).ifPresent(suggestions::add);
        }
        return optimizeResolutions(suggestions, context.securityLevel());
    }

    /**
     * Tries the strategies for the conflict's kind in priority order.
     *
     * @return the first suggestion produced, or empty when every strategy fails
     */
    public Optional<ResolutionSuggestion> resolveConflict(Conflict conflict, ResolutionContext context) {
        String key = cacheKey(conflict, context);
        List<ResolutionSuggestion> cached = resolutionCache.getIfPresent(key);
        if (cached != null) {
            return cached.stream().findFirst();
        }

        ResolutionSuggestion suggestion = null;
        for (ResolutionStrategy strategy : strategiesFor(conflict.kind(), context.securityLevel())) {
            suggestion = apply(strategy, conflict, context);
            if (suggestion != null) {
                break;
            }
        }
        if (suggestion != null && !context.allowAutomaticFixes() && suggestion.autoFix() != null) {
            suggestion = ResolutionSuggestion.guidance(suggestion.kind(), suggestion.message());
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Resolution for %s: %s", conflict.kind(),
                    suggestion == null ? "none" : suggestion.kind()));
        }
        resolutionCache.put(key, suggestion == null ? List.of() : List.of(suggestion));
        return Optional.ofNullable(suggestion);
    }

    static List<ResolutionStrategy> strategiesFor(ConflictKind kind, SecurityLevel level) {
        switch (kind) {
            case ALLOW_OVERRIDES_DENY:
                return List.of(
                        level == SecurityLevel.STRICT
                                ? ResolutionStrategy.REMOVE_CONFLICTING_RULE
                                : ResolutionStrategy.MAKE_ALLOW_MORE_RESTRICTIVE,
                        ResolutionStrategy.MAKE_DENY_MORE_SPECIFIC,
                        ResolutionStrategy.MANUAL_REVIEW_REQUIRED);
            case PRECEDENCE_AMBIGUITY:
                return List.of(
                        ResolutionStrategy.MAKE_DENY_MORE_SPECIFIC,
                        ResolutionStrategy.REMOVE_CONFLICTING_RULE,
                        ResolutionStrategy.MANUAL_REVIEW_REQUIRED);
            case CONTRADICTORY_RULES:
                return List.of(
                        ResolutionStrategy.MANUAL_REVIEW_REQUIRED,
                        ResolutionStrategy.REMOVE_CONFLICTING_RULE);
            case OVERLAPPING_PATTERNS:
                return List.of(
                        ResolutionStrategy.REMOVE_CONFLICTING_RULE,
                        ResolutionStrategy.MAKE_ALLOW_MORE_RESTRICTIVE);
            case SECURITY_VIOLATION:
            default:
                return List.of(ResolutionStrategy.MANUAL_REVIEW_REQUIRED);
        }
    }

    private ResolutionSuggestion apply(ResolutionStrategy strategy, Conflict conflict, ResolutionContext context) {
        switch (strategy) {
            case REMOVE_CONFLICTING_RULE:
                return removeConflictingRule(conflict, context);
            case MAKE_ALLOW_MORE_RESTRICTIVE:
                return makeAllowMoreRestrictive(conflict, context);
            case MAKE_DENY_MORE_SPECIFIC:
                return makeDenyMoreSpecific(conflict, context);
            case MANUAL_REVIEW_REQUIRED:
            default:
                return manualReview(conflict);
        }
    }

    // ---- remove ---------------------------------------------------------------------------

    private ResolutionSuggestion removeConflictingRule(Conflict conflict, ResolutionContext context) {
        List<ConflictingRule> rules = conflict.conflictingRules();
        if (rules.isEmpty()) {
            return null;
        }

        ConflictingRule victim;
        if (context.securityLevel() == SecurityLevel.STRICT) {
            victim = rules.stream()
                    .filter(r -> r.category() != RuleCategory.DENY)
                    .findFirst()
                    .orElse(null);
            if (victim == null) {
                return null;
            }
        } else if (rules.size() == 1) {
            victim = rules.get(0);
        } else {
            ConflictingRule rule1 = rules.get(0);
            ConflictingRule rule2 = rules.get(1);
            victim = specificity(rule1.pattern()) > specificity(rule2.pattern()) ? rule2 : rule1;
        }

        if (victim.category() == RuleCategory.DENY) {
            return ResolutionSuggestion.guidance(SuggestionKind.WARNING, String.format(
                    "Deny rule \"%s\" is the least specific rule in this conflict. "
                            + "Deny rules are never removed automatically; review it by hand.",
                    victim.pattern()));
        }

        String reason = String.format("Resolve %s with %s rule \"%s\"",
                conflict.kind(), otherCategory(rules, victim), otherPattern(rules, victim));
        return new ResolutionSuggestion(
                SuggestionKind.FIX,
                String.format("Remove %s rule \"%s\" to resolve the conflict", victim.category().key(), victim.pattern()),
                new AutoFix(
                        String.format("Remove %s rule \"%s\"", victim.category().key(), victim.pattern()),
                        new Change.Remove(victim.category(), victim.pattern(), reason)));
    }

    /**
     * Wildcards lower the score, path separators and length raise it.
     */
    static int specificity(String pattern) {
        return 100
                - 20 * STAR.countIn(pattern)
                - 10 * QUESTION.countIn(pattern)
                + 5 * SLASH.countIn(pattern)
                + Math.min(pattern.length(), 20);
    }

    // ---- restrict allow / ask -------------------------------------------------------------

    private ResolutionSuggestion makeAllowMoreRestrictive(Conflict conflict, ResolutionContext context) {
        ConflictingRule target = conflict.conflictingRules().stream()
                .filter(r -> r.category() != RuleCategory.DENY)
                .findFirst()
                .orElse(null);
        if (target == null) {
            return null;
        }

        String restricted = restrict(conflict.kind(), target.pattern());
        if (restricted.equals(target.pattern()) || !isVerified(restricted, target, conflict, context)) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Rejected restriction \"%s\" -> \"%s\"", target.pattern(), restricted));
            }
            return null;
        }

        return new ResolutionSuggestion(
                SuggestionKind.FIX,
                String.format("Restrict %s rule \"%s\" to \"%s\" so it no longer overlaps denied inputs",
                        target.category().key(), target.pattern(), restricted),
                new AutoFix(
                        String.format("Replace \"%s\" with \"%s\"", target.pattern(), restricted),
                        new Change.Modify(target.category(), target.pattern(), restricted,
                                "Narrow the rule to avoid overlapping deny rules")));
    }

    static String restrict(ConflictKind kind, String pattern) {
        boolean allowOverridesDeny = kind == ConflictKind.ALLOW_OVERRIDES_DENY;
        if (allowOverridesDeny && (pattern.equals("*") || pattern.equals("**"))) {
            return "*.safe";
        }
        if (allowOverridesDeny && pattern.indexOf('/') < 0) {
            return "safe/" + pattern;
        }
        if (pattern.endsWith("*") && !pattern.endsWith("**")) {
            return pattern.substring(0, pattern.length() - 1) + "*.txt";
        }
        return genericRestriction(pattern);
    }

    private static String genericRestriction(String pattern) {
        if (pattern.equals("*")) {
            return "*.txt";
        }
        if (pattern.equals("**")) {
            return "safe/**";
        }
        if (pattern.equals(".*")) {
            return ".config";
        }
        if (pattern.indexOf('/') < 0) {
            return "allowed/" + pattern;
        }
        if (pattern.endsWith("*") && STAR.countIn(pattern) == 1) {
            return pattern + ".allowed";
        }
        if (pattern.indexOf('*') >= 0) {
            return pattern.replace("*", "allowed");
        }
        return pattern + ".allowed";
    }

    /**
     * The candidate must not overlap any deny rule of the conflict or of the whole rule set.
     */
    private boolean isVerified(String candidate, ConflictingRule target, Conflict conflict, ResolutionContext context) {
        NormalizedRule normalized = patternEngine.normalize(candidate, target.category(), 0);
        List<NormalizedRule> opposing = new ArrayList<>();
        for (ConflictingRule rule : conflict.conflictingRules()) {
            if (rule.category() != target.category()) {
                opposing.add(patternEngine.normalize(rule.pattern(), rule.category(), 0));
            }
        }
        context.rules().stream()
                .filter(r -> r.category() == RuleCategory.DENY)
                .forEach(opposing::add);

        for (NormalizedRule rule : opposing) {
            if (overlapDetector.analyzeOverlap(normalized, rule).overlaps()) {
                return false;
            }
        }
        return true;
    }

    // ---- deny specificity -----------------------------------------------------------------

    private ResolutionSuggestion makeDenyMoreSpecific(Conflict conflict, ResolutionContext context) {
        ConflictingRule deny = conflict.conflictingRules().stream()
                .filter(r -> r.category() == RuleCategory.DENY)
                .findFirst()
                .orElse(null);
        if (deny == null) {
            return null;
        }

        String narrowed = narrowDeny(deny.pattern());
        if (narrowed == null) {
            return null;
        }
        if (context.securityLevel() == SecurityLevel.STRICT
                && securityScore(narrowed) < securityScore(deny.pattern())) {
            return null;
        }

        return ResolutionSuggestion.guidance(SuggestionKind.WARNING, String.format(
                "Consider making deny rule \"%s\" more specific, for example \"%s\". "
                        + "Deny rules are never modified automatically; confirm the intended scope first.",
                deny.pattern(), narrowed));
    }

    static String narrowDeny(String pattern) {
        if (pattern.equals("*")) {
            return "dangerous.*";
        }
        if (pattern.equals("**")) {
            return "**/dangerous/**";
        }
        if (pattern.indexOf('/') < 0) {
            return "dangerous/" + pattern;
        }
        if (pattern.indexOf('*') >= 0) {
            return pattern.replaceFirst("\\*", "dangerous");
        }
        if (pattern.indexOf('.') < 0) {
            return pattern + ".dangerous";
        }
        return null;
    }

    static int securityScore(String pattern) {
        int score = 50;
        if (STAR.countIn(pattern) == 0 && QUESTION.countIn(pattern) == 0) {
            score += 30;
        }
        score += Math.min(pattern.length(), 20);
        score += 5 * SLASH.countIn(pattern);
        score -= 10 * STAR.countIn(pattern);
        score -= 5 * QUESTION.countIn(pattern);
        return Math.max(0, Math.min(100, score));
    }

    // ---- manual ---------------------------------------------------------------------------

    private static ResolutionSuggestion manualReview(Conflict conflict) {
        boolean hasDeny = conflict.involves(RuleCategory.DENY);
        boolean mixed = hasDeny && (conflict.involves(RuleCategory.ALLOW) || conflict.involves(RuleCategory.ASK));

        String guidance;
        if (mixed) {
            guidance = "A deny rule conflicts with a permissive rule. Exercise extreme caution.";
        } else if (conflict.conflictingRules().size() > 2) {
            guidance = "Multiple rules are involved. Consider consolidating them.";
        } else if (conflict.securityImpact() == Severity.CRITICAL) {
            guidance = "This critical issue requires immediate attention.";
        } else {
            guidance = "Review the business logic to determine the correct precedence.";
        }
        return ResolutionSuggestion.guidance(SuggestionKind.WARNING, String.format(
                "Manual review required for %s: %s. %s", conflict.kind(), stripPeriod(conflict.message()), guidance));
    }

    private static String stripPeriod(String message) {
        return message.endsWith(".") ? message.substring(0, message.length() - 1) : message;
    }

    // ---- optimization ---------------------------------------------------------------------

    /**
     * Deduplicates auto-fixes by (category, pattern), orders fixes before warnings before
     * optimizations and, in permissive mode, caps the list while keeping critical suggestions.
     */
    public List<ResolutionSuggestion> optimizeResolutions(List<ResolutionSuggestion> suggestions, SecurityLevel level) {
        Map<String, ResolutionSuggestion> unique = new LinkedHashMap<>();
        for (ResolutionSuggestion suggestion : suggestions) {
            String key = suggestion.fix()
                    .map(fix -> "fix|" + fix.change().category() + "|" + changedPattern(fix.change()))
                    .orElse("msg|" + suggestion.kind() + "|" + suggestion.message());
            unique.putIfAbsent(key, suggestion);
        }

        List<ResolutionSuggestion> ordered = new ArrayList<>(unique.values());
        ordered.sort(Comparator.comparingInt(s -> s.kind().ordinal()));

        if (level != SecurityLevel.PERMISSIVE || ordered.size() <= PERMISSIVE_SUGGESTION_CAP) {
            return ordered;
        }
        List<ResolutionSuggestion> critical = ordered.stream()
                .filter(ResolutionEngine::isCritical)
                .collect(Collectors.toList());
        List<ResolutionSuggestion> capped = new ArrayList<>();
        int room = Math.max(0, PERMISSIVE_SUGGESTION_CAP - critical.size());
        for (ResolutionSuggestion suggestion : ordered) {
            if (isCritical(suggestion)) {
                capped.add(suggestion);
            } else if (room > 0) {
                capped.add(suggestion);
                room--;
            }
        }
        return capped;
    }

    private static boolean isCritical(ResolutionSuggestion suggestion) {
        String message = suggestion.message();
        return message.contains("CRITICAL") || message.toLowerCase(Locale.ROOT).contains("zero-bypass");
    }

    private static String changedPattern(Change change) {
        if (change instanceof Change.Modify) {
            return ((Change.Modify) change).originalPattern();
        }
        if (change instanceof Change.Add) {
            return ((Change.Add) change).pattern();
        }
        if (change instanceof Change.Remove) {
            return ((Change.Remove) change).pattern();
        }
        return ((Change.Reorder) change).pattern();
    }

    // ---- apply ----------------------------------------------------------------------------

    /**
     * Applies the auto-fixes of the given suggestions to a copy of {@code config} and re-runs
     * conflict detection on the result. Changes to deny rules are refused.
     */
    public ResolutionResult applyResolutions(PermissionsConfig config, List<ResolutionSuggestion> suggestions) {
        Map<RuleCategory, List<String>> rules = new EnumMap<>(RuleCategory.class);
        for (RuleCategory category : RuleCategory.values()) {
            rules.put(category, new ArrayList<>(config.rules(category)));
        }

        List<ConfigurationChange> applied = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        for (ResolutionSuggestion suggestion : suggestions) {
            if (suggestion.autoFix() == null) {
                continue;
            }
            Change change = suggestion.autoFix().change();
            if (change.category() == RuleCategory.DENY) {
                messages.add("Refused to change deny rules automatically: " + suggestion.autoFix().description());
                continue;
            }
            ConfigurationChange result = applyChange(rules.get(change.category()), change);
            if (result == null) {
                messages.add("Skipped inapplicable change: " + suggestion.autoFix().description());
            } else {
                applied.add(result);
                messages.add("Applied: " + suggestion.autoFix().description());
            }
        }

        PermissionsConfig resolved = new PermissionsConfig(
                rules.get(RuleCategory.DENY), rules.get(RuleCategory.ALLOW), rules.get(RuleCategory.ASK),
                config.metadata());
        List<Conflict> remaining = detectionEngine.detectConflicts(
                ruleNormalizer.normalize(resolved),
                new DetectionOptions(true, false, false, true, 0, List.of())).conflicts();

        messages.add(String.format("Applied %d of %d suggestions, %d conflicts remain",
                applied.size(), suggestions.size(), remaining.size()));
        logger.info(String.format("Applied %d resolution changes, %d conflicts remain", applied.size(), remaining.size()));
        return new ResolutionResult(remaining.isEmpty(), resolved, applied, messages, remaining);
    }

    private static ConfigurationChange applyChange(List<String> rules, Change change) {
        if (change instanceof Change.Remove) {
            Change.Remove remove = (Change.Remove) change;
            int index = rules.indexOf(remove.pattern());
            if (index < 0) {
                return null;
            }
            rules.remove(index);
            return new ConfigurationChange(ChangeAction.REMOVE, remove.category(), remove.pattern(), null,
                    index, remove.reason(), riskOf(change));
        }
        if (change instanceof Change.Modify) {
            Change.Modify modify = (Change.Modify) change;
            int index = rules.indexOf(modify.originalPattern());
            if (index < 0) {
                return null;
            }
            rules.set(index, modify.newPattern());
            return new ConfigurationChange(ChangeAction.MODIFY, modify.category(), modify.originalPattern(),
                    modify.newPattern(), index, modify.reason(), riskOf(change));
        }
        if (change instanceof Change.Add) {
            Change.Add add = (Change.Add) change;
            if (rules.contains(add.pattern())) {
                return null;
            }
            int index = add.position() == null ? rules.size() : Math.max(0, Math.min(add.position(), rules.size()));
            rules.add(index, add.pattern());
            return new ConfigurationChange(ChangeAction.ADD, add.category(), null, add.pattern(),
                    index, add.reason(), riskOf(change));
        }
        Change.Reorder reorder = (Change.Reorder) change;
        int from = rules.indexOf(reorder.pattern());
        if (from < 0) {
            return null;
        }
        rules.remove(from);
        int to = Math.max(0, Math.min(reorder.newPosition(), rules.size()));
        rules.add(to, reorder.pattern());
        return new ConfigurationChange(ChangeAction.REORDER, reorder.category(), reorder.pattern(), reorder.pattern(),
                to, reorder.reason(), riskOf(change));
    }

    static ChangeRisk riskOf(Change change) {
        if (change.category() == RuleCategory.DENY && change.action() == ChangeAction.REMOVE) {
            return ChangeRisk.RISKY;
        }
        if (change.action() == ChangeAction.ADD && change.category() == RuleCategory.ALLOW) {
            return ChangeRisk.MODERATE;
        }
        if (change.action() == ChangeAction.MODIFY) {
            return ChangeRisk.MODERATE;
        }
        return ChangeRisk.SAFE;
    }

    public void clearCache() {
        resolutionCache.invalidateAll();
    }

    // ---- helpers --------------------------------------------------------------------------

    private static String cacheKey(Conflict conflict, ResolutionContext context) {
        String patterns = conflict.conflictingRules().stream()
                .map(r -> r.category().key() + ":" + r.pattern())
                .sorted()
                .collect(Collectors.joining("|"));
        String denies = context.rules().stream()
                .filter(r -> r.category() == RuleCategory.DENY)
                .map(NormalizedRule::original)
                .sorted()
                .collect(Collectors.joining("|"));
        return context.securityLevel() + "#" + conflict.kind() + "#" + context.allowAutomaticFixes()
                + "#" + conflict.securityImpact() + "#" + patterns + "#deny=" + denies;
    }

    private static String otherPattern(List<ConflictingRule> rules, ConflictingRule victim) {
        return rules.stream().filter(r -> r != victim).map(ConflictingRule::pattern).findFirst().orElse("");
    }

    private static String otherCategory(List<ConflictingRule> rules, ConflictingRule victim) {
        return rules.stream().filter(r -> r != victim).map(r -> r.category().key()).findFirst().orElse("");
    }
}
