/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.ValidationListener;
import com.aegis.permissions.api.model.ValidationPhase;
import com.aegis.permissions.api.model.ValidationState;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes phase transitions to {@link ValidationEngine#getState()} and to an optional listener.
 * State is observability only and never drives control flow. A failing listener is logged and
 * otherwise ignored.
 */
final class ValidationStateTracker {

    private static final Logger logger = Logger.getLogger(ValidationStateTracker.class.getName());

    private final AtomicReference<ValidationState> state =
            new AtomicReference<>(ValidationState.of(ValidationPhase.INITIALIZING));
    private final ValidationListener listener;

    ValidationStateTracker(ValidationListener listener) {
        this.listener = listener;
    }

    ValidationState current() {
        return state.get();
    }

    void start(ValidationPhase phase, int ruleCount) {
        state.set(ValidationState.of(phase));
        if (listener != null) {
            try {
                listener.onPhaseStart(phase, ruleCount);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Validation listener failed in onPhaseStart for " + phase, e);
            }
        }
    }

    void complete(ValidationPhase phase, long startNanos, Map<String, Object> metrics) {
        long duration = System.nanoTime() - startNanos;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Phase %s completed in %.3f ms %s", phase, duration / 1_000_000.0, metrics));
        }
        if (listener != null) {
            try {
                listener.onPhaseComplete(phase, new ValidationListener.PhaseResult(phase, duration, metrics));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Validation listener failed in onPhaseComplete for " + phase, e);
            }
        }
    }

    void finish(ValidationPhase terminal) {
        state.set(ValidationState.of(terminal));
    }

    void fail(ValidationPhase phase, Exception error) {
        state.set(ValidationState.of(ValidationPhase.FAILED));
        if (listener != null) {
            try {
                listener.onError(phase, error);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Validation listener failed in onError for " + phase, e);
            }
        }
    }
}
