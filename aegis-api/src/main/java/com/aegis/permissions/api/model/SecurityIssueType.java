/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum SecurityIssueType {
    ZERO_BYPASS_VIOLATION,
    OVERLY_BROAD,
    WEAK_PATTERN,
    OVERLY_PERMISSIVE,
    MISSING_DENY
}
