/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum ValidationWarningType {
    INVALID_PATTERN,
    BEST_PRACTICE_VIOLATION,
    PERFORMANCE_WARNING,
    SECURITY_WARNING
}
