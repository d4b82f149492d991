/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.ChangeAction;
import com.aegis.permissions.api.model.RuleCategory;

/**
 * Audit record of a change applied to a configuration.
 */
public record ConfigurationChange(
        ChangeAction type,
        RuleCategory category,
        String originalValue,
        String newValue,
        Integer position,
        String reason,
        ChangeRisk risk
) {
}
