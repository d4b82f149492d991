/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.analysis.ResolutionContext;
import com.aegis.permissions.analysis.ResolutionEngine;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.ResolutionSuggestion;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.SecurityAnalysis;
import com.aegis.permissions.api.model.SecurityIssue;
import com.aegis.permissions.api.model.SecurityLevel;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.SuggestionKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects conflict resolutions, security remediation hints and best-practice advice
 * into the suggestion list of a validation result, ordered fixes first and optimizations last.
 */
public final class SuggestionGenerator {

    static final int COMPLEX_REGEX_LENGTH = 50;

    private final ResolutionEngine resolutionEngine;

    public SuggestionGenerator(ResolutionEngine resolutionEngine) {
        this.resolutionEngine = resolutionEngine;
    }

    public List<ResolutionSuggestion> generate(List<NormalizedRule> rules,
                                               List<Conflict> conflicts,
                                               SecurityAnalysis analysis,
                                               SecurityLevel securityLevel) {
        List<ResolutionSuggestion> suggestions = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (!conflicts.isEmpty()) {
            ResolutionContext context = new ResolutionContext(rules, conflicts, securityLevel, true);
            for (ResolutionSuggestion suggestion : resolutionEngine.generateResolutions(context)) {
                add(suggestions, seen, suggestion);
            }
        }

        for (SecurityIssue issue : analysis.issues()) {
            SuggestionKind kind = issue.severity() == Severity.CRITICAL ? SuggestionKind.FIX : SuggestionKind.WARNING;
            add(suggestions, seen, ResolutionSuggestion.guidance(kind, SecurityAnalyzer.suggestedFix(issue.type())));
        }

        long complexRegexes = rules.stream()
                .filter(r -> r.kind() == PatternKind.REGEX && r.original().length() > COMPLEX_REGEX_LENGTH)
                .count();
        if (complexRegexes > 0) {
            add(suggestions, seen, ResolutionSuggestion.guidance(SuggestionKind.OPTIMIZATION, String.format(
                    "%d complex regex patterns detected. Consider simplifying for better performance.",
                    complexRegexes)));
        }

        boolean deniesExecution = rules.stream()
                .anyMatch(r -> r.category() == RuleCategory.DENY && r.original().contains("exec"));
        if (!deniesExecution) {
            add(suggestions, seen, ResolutionSuggestion.guidance(SuggestionKind.WARNING,
                    "Consider adding deny rules for shell execution commands"));
        }
        // stable, so each kind keeps its insertion order
        suggestions.sort(Comparator.comparingInt(s -> s.kind().ordinal()));
        return suggestions;
    }

    private static void add(List<ResolutionSuggestion> suggestions, Set<String> seen, ResolutionSuggestion suggestion) {
        String key = suggestion.autoFix() != null
                ? suggestion.kind() + "|" + suggestion.message() + "|" + suggestion.autoFix().change()
                : suggestion.kind() + "|" + suggestion.message();
        if (seen.add(key)) {
            suggestions.add(suggestion);
        }
    }
}
