/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Optional;

/**
 * A suggestion for resolving a conflict or improving a configuration.
 *
 * @param kind    fix, warning or optimization
 * @param message human-readable guidance
 * @param autoFix applicable change, or {@code null} when the suggestion is guidance only
 */
public record ResolutionSuggestion(SuggestionKind kind, String message, AutoFix autoFix) {

    public static ResolutionSuggestion guidance(SuggestionKind kind, String message) {
        return new ResolutionSuggestion(kind, message, null);
    }

    public Optional<AutoFix> fix() {
        return Optional.ofNullable(autoFix);
    }
}
