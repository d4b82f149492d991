/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum ResolutionStrategy {
    REMOVE_CONFLICTING_RULE,
    MAKE_ALLOW_MORE_RESTRICTIVE,
    MAKE_DENY_MORE_SPECIFIC,
    MANUAL_REVIEW_REQUIRED
}
