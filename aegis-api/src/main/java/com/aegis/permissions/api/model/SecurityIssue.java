/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;

public record SecurityIssue(
        SecurityIssueType type,
        Severity severity,
        String message,
        List<String> affectedRules
) {
    public SecurityIssue {
        affectedRules = List.copyOf(affectedRules);
    }
}
