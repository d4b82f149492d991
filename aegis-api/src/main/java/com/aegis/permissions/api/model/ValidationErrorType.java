/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum ValidationErrorType {
    /** Unparseable configuration, internal failure or timeout. */
    INVALID_SYNTAX,
    INVALID_PATTERN,
    SECURITY_VIOLATION,
    RULE_CONFLICT
}
