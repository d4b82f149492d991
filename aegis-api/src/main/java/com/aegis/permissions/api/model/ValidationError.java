/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Map;

/**
 * An error that makes a configuration invalid.
 *
 * @param type     error class
 * @param message  human-readable description
 * @param location configuration path, or {@code null} when the error is not tied to a rule
 * @param context  additional string attributes (patterns, elapsed time, ...)
 * @param severity impact
 */
public record ValidationError(
        ValidationErrorType type,
        String message,
        String location,
        Map<String, String> context,
        Severity severity
) {
    public ValidationError {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ValidationError of(ValidationErrorType type, String message, Severity severity) {
        return new ValidationError(type, message, null, Map.of(), severity);
    }
}
