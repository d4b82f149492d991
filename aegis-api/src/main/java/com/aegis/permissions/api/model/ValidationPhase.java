/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Phases of the validation pipeline with their nominal progress.
 */
public enum ValidationPhase {
    INITIALIZING(0, "Initializing validation"),
    PARSING(5, "Parsing configuration"),
    NORMALIZING(10, "Normalizing rules"),
    VALIDATING(20, "Validating individual rules"),
    DETECTING_CONFLICTS(50, "Detecting rule conflicts"),
    ANALYZING_SECURITY(80, "Analyzing security posture"),
    GENERATING_SUGGESTIONS(90, "Generating suggestions"),
    COMPLETE(100, "Validation complete"),
    FAILED(100, "Validation failed");

    private final int progress;
    private final String description;

    ValidationPhase(int progress, String description) {
        this.progress = progress;
        this.description = description;
    }

    public int progress() {
        return progress;
    }

    public String description() {
        return description;
    }
}
