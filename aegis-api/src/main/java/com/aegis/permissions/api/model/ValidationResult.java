/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;
import java.util.Map;

/**
 * Terminal artifact of a validation call. Always well-formed, including on internal failure.
 *
 * <p>{@code valid} is true exactly when {@code errors} is empty.
 */
public record ValidationResult(
        boolean valid,
        List<ValidationError> errors,
        List<ValidationWarning> warnings,
        List<Conflict> conflicts,
        List<ResolutionSuggestion> suggestions,
        ValidationPerformance performance,
        String configurationHash,
        int securityScore
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        conflicts = List.copyOf(conflicts);
        suggestions = List.copyOf(suggestions);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must equal errors.isEmpty()");
        }
    }

    /**
     * Builds a result whose validity is derived from the error list.
     */
    public static ValidationResult of(List<ValidationError> errors,
                                      List<ValidationWarning> warnings,
                                      List<Conflict> conflicts,
                                      List<ResolutionSuggestion> suggestions,
                                      ValidationPerformance performance,
                                      String configurationHash,
                                      int securityScore) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, conflicts, suggestions,
                performance, configurationHash, securityScore);
    }

    /**
     * Terminal failure carrying a single {@link ValidationErrorType#INVALID_SYNTAX} error.
     */
    public static ValidationResult failure(String message, long elapsedMs, long targetMs) {
        ValidationError error = new ValidationError(
                ValidationErrorType.INVALID_SYNTAX,
                message,
                null,
                Map.of("elapsedMs", Long.toString(elapsedMs)),
                Severity.CRITICAL);
        return new ValidationResult(false, List.of(error), List.of(), List.of(), List.of(),
                new ValidationPerformance(elapsedMs, 0, targetMs, false), null, 0);
    }
}
