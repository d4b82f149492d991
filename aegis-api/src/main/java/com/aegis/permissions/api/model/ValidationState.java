/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Observable progress of the most recent validation call.
 */
public record ValidationState(ValidationPhase phase, int progress, String description) {

    public static ValidationState of(ValidationPhase phase) {
        return new ValidationState(phase, phase.progress(), phase.description());
    }
}
