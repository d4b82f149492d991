/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api;

import com.aegis.permissions.api.model.ValidationPhase;

import java.util.Map;

/**
 * Callback interface for validation phase events.
 *
 * <p>Callbacks run on the validating thread and must not block. Listener failures are logged
 * and never affect the validation outcome.
 */
public interface ValidationListener {

    /**
     * Called when a phase starts.
     *
     * @param phase     the phase
     * @param ruleCount number of rules known at this point (0 before normalization)
     */
    void onPhaseStart(ValidationPhase phase, int ruleCount);

    /**
     * Called when a phase completes.
     */
    void onPhaseComplete(ValidationPhase phase, PhaseResult result);

    /**
     * Called when a phase fails with an exception. The failure is converted into the result.
     */
    void onError(ValidationPhase phase, Exception error);

    /**
     * Result of a single phase.
     *
     * @param phase         the phase
     * @param durationNanos duration in nanoseconds
     * @param metrics       phase-specific metrics (e.g. "conflicts", "rules")
     */
    record PhaseResult(ValidationPhase phase, long durationNanos, Map<String, Object> metrics) {

        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
