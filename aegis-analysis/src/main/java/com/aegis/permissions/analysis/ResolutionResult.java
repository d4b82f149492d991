/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.PermissionsConfig;

import java.util.List;

/**
 * Outcome of applying resolution suggestions to a configuration.
 *
 * @param success            true when no conflict remains in the resolved configuration
 * @param resolvedConfig     configuration with all applicable changes
 * @param changes            changes actually applied
 * @param messages           one message per suggestion with an auto-fix
 * @param remainingConflicts conflicts detected in the resolved configuration
 */
public record ResolutionResult(
        boolean success,
        PermissionsConfig resolvedConfig,
        List<ConfigurationChange> changes,
        List<String> messages,
        List<Conflict> remainingConflicts
) {
    public ResolutionResult {
        changes = List.copyOf(changes);
        messages = List.copyOf(messages);
        remainingConflicts = List.copyOf(remainingConflicts);
    }
}
