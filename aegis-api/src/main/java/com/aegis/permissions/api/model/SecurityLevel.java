/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * How aggressively conflicts are resolved.
 */
public enum SecurityLevel {
    STRICT,
    MODERATE,
    PERMISSIVE
}
