/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.SecurityLevel;

import java.util.List;

/**
 * Inputs shared by all resolutions of one validation run.
 *
 * @param rules               all normalized rules of the configuration
 * @param conflicts           all detected conflicts
 * @param securityLevel       how aggressively to resolve
 * @param allowAutomaticFixes when false, suggestions never carry an auto-fix
 */
public record ResolutionContext(
        List<NormalizedRule> rules,
        List<Conflict> conflicts,
        SecurityLevel securityLevel,
        boolean allowAutomaticFixes
) {
    public ResolutionContext {
        rules = List.copyOf(rules);
        conflicts = List.copyOf(conflicts);
    }
}
