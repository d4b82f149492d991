/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * A machine-applicable fix.
 */
public record AutoFix(String description, Change change) {
}
