/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call validation options.
 *
 * @param strictMode            strict security level, strict timeouts and deep weakness analysis
 * @param skipConflictDetection skip all detection passes except zero-bypass
 * @param skipCache             bypass the result and detection caches
 * @param timeoutMs             deadline for the call; 0 disables it
 * @param parallel              allow sharded pairwise analysis
 * @param workerCount           worker count for sharded analysis; 0 uses the engine default
 * @param customPatterns        extra probe inputs for overlap analysis
 */
public record ValidationOptions(
        boolean strictMode,
        boolean skipConflictDetection,
        boolean skipCache,
        long timeoutMs,
        boolean parallel,
        int workerCount,
        List<String> customPatterns
) {
    private static final ValidationOptions DEFAULTS = builder().build();

    public ValidationOptions {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
        customPatterns = customPatterns == null ? List.of() : List.copyOf(customPatterns);
    }

    public static ValidationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean strictMode;
        private boolean skipConflictDetection;
        private boolean skipCache;
        private long timeoutMs;
        private boolean parallel = true;
        private int workerCount;
        private final List<String> customPatterns = new ArrayList<>();

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder skipConflictDetection(boolean skip) {
            this.skipConflictDetection = skip;
            return this;
        }

        public Builder skipCache(boolean skip) {
            this.skipCache = skip;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder customPattern(String pattern) {
            this.customPatterns.add(pattern);
            return this;
        }

        public Builder customPatterns(List<String> patterns) {
            this.customPatterns.addAll(patterns);
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(strictMode, skipConflictDetection, skipCache, timeoutMs,
                    parallel, workerCount, customPatterns);
        }
    }
}
