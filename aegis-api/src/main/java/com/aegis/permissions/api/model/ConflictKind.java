/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum ConflictKind {
    ALLOW_OVERRIDES_DENY,
    OVERLAPPING_PATTERNS,
    CONTRADICTORY_RULES,
    PRECEDENCE_AMBIGUITY,
    SECURITY_VIOLATION
}
