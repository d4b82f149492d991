/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Kind of resolution suggestion, in presentation order.
 */
public enum SuggestionKind {
    FIX,
    WARNING,
    OPTIMIZATION
}
