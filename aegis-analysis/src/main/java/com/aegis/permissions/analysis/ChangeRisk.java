/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

public enum ChangeRisk {
    SAFE,
    MODERATE,
    RISKY
}
