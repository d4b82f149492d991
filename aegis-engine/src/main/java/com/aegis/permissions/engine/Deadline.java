/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.exception.ValidationTimeoutException;
import com.aegis.permissions.api.model.ValidationPhase;

/**
 * Wall-clock budget of one validation call, checked at phase boundaries only.
 */
final class Deadline {

    private final long startNanos;
    private final long timeoutNanos;
    private final boolean strict;
    private boolean expired;

    private Deadline(long startNanos, long timeoutMs, boolean strict) {
        this.startNanos = startNanos;
        this.timeoutNanos = timeoutMs * 1_000_000L;
        this.strict = strict;
    }

    /**
     * @param timeoutMs 0 disables the deadline
     * @param strict    whether expiry aborts validation
     */
    static Deadline start(long startNanos, long timeoutMs, boolean strict) {
        return new Deadline(startNanos, timeoutMs, strict);
    }

    long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /**
     * Records expiry. In strict mode an expired deadline throws.
     *
     * @param next the phase about to start
     * @throws ValidationTimeoutException if the deadline expired and the deadline is strict
     */
    void check(ValidationPhase next) {
        if (timeoutNanos <= 0 || System.nanoTime() - startNanos <= timeoutNanos) {
            return;
        }
        expired = true;
        if (strict) {
            throw new ValidationTimeoutException(String.format(
                    "Validation timed out after %d ms before %s (timeout %d ms)",
                    elapsedMs(), next, timeoutNanos / 1_000_000L), elapsedMs());
        }
    }

    boolean expired() {
        return expired;
    }
}
