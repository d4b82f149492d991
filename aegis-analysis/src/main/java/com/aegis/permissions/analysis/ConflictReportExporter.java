/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.exception.ValidationException;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a {@link ConflictDetectionResult} as JSON or Markdown.
 */
public final class ConflictReportExporter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String export(ConflictDetectionResult result, ReportFormat format) {
        switch (format) {
            case JSON:
                return toJson(result);
            case MARKDOWN:
                return toMarkdown(result);
            default:
                throw new IllegalArgumentException("Unsupported report format: " + format);
        }
    }

    private String toJson(ConflictDetectionResult result) {
        Report report = new Report(
                new Summary(result.conflicts().size(),
                        result.countBySeverity(Severity.CRITICAL),
                        result.countBySeverity(Severity.HIGH),
                        result.countBySeverity(Severity.MEDIUM),
                        result.countBySeverity(Severity.LOW),
                        result.pairsAnalyzed(),
                        result.detectionTimeMs()),
                result.conflicts());
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Failed to render conflict report: " + e.getOriginalMessage(), e);
        }
    }

    private static String toMarkdown(ConflictDetectionResult result) {
        StringBuilder out = new StringBuilder();
        out.append("# Conflict Detection Report\n\n");
        out.append("## Summary\n\n");
        out.append("- Total conflicts: ").append(result.conflicts().size()).append('\n');
        for (Severity severity : Severity.values()) {
            out.append("- ").append(capitalize(severity.name())).append(": ")
                    .append(result.countBySeverity(severity)).append('\n');
        }
        out.append(String.format(Locale.ROOT, "- Detection time: %.2f ms%n", result.detectionTimeMs()));
        out.append("- Pairs analyzed: ").append(result.pairsAnalyzed()).append("\n\n");

        out.append("## Critical Violations\n\n");
        List<Conflict> critical = result.conflicts().stream()
                .filter(c -> c.securityImpact() == Severity.CRITICAL)
                .collect(Collectors.toList());
        if (critical.isEmpty()) {
            out.append("_No critical violations detected._\n");
        } else {
            critical.forEach(c -> appendConflict(out, c));
        }

        List<Conflict> others = result.conflicts().stream()
                .filter(c -> c.securityImpact() != Severity.CRITICAL)
                .collect(Collectors.toList());
        if (!others.isEmpty()) {
            out.append("\n## Other Conflicts\n\n");
            others.forEach(c -> appendConflict(out, c));
        }
        return out.toString();
    }

    private static void appendConflict(StringBuilder out, Conflict conflict) {
        out.append("### ").append(conflict.kind()).append(" (").append(conflict.securityImpact()).append(")\n\n");
        out.append(conflict.message()).append("\n\n");
        for (ConflictingRule rule : conflict.conflictingRules()) {
            out.append("- `").append(rule.pattern()).append("` at ").append(rule.location()).append('\n');
        }
        out.append("\nResolution: ").append(conflict.resolutionStrategy()).append("\n\n");
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    record Report(Summary summary, List<Conflict> conflicts) {
    }

    record Summary(int totalConflicts, long critical, long high, long medium, long low,
                           long pairsAnalyzed, double detectionTimeMs) {
    }
}
