/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Map;

public record ValidationWarning(
        ValidationWarningType type,
        String message,
        String location,
        Map<String, String> context
) {
    public ValidationWarning {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ValidationWarning of(ValidationWarningType type, String message, String location) {
        return new ValidationWarning(type, message, location, Map.of());
    }
}
