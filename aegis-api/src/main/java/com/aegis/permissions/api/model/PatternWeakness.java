/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;

/**
 * An intrinsic weakness of a single pattern.
 */
public record PatternWeakness(
        WeaknessType type,
        Severity severity,
        String description,
        List<String> exploitExamples,
        String resolution
) {
    public PatternWeakness {
        exploitExamples = List.copyOf(exploitExamples);
    }
}
