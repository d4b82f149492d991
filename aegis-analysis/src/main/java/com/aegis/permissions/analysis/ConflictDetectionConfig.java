/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

/**
 * Tuning of the conflict detection engine.
 */
public final class ConflictDetectionConfig {

    private final boolean parallel;
    private final int workerCount;
    private final int parallelThreshold;
    private final boolean deepAnalysis;
    private final int detectionCacheSize;

    private ConflictDetectionConfig(Builder builder) {
        this.parallel = builder.parallel;
        this.workerCount = builder.workerCount;
        this.parallelThreshold = builder.parallelThreshold;
        this.deepAnalysis = builder.deepAnalysis;
        this.detectionCacheSize = builder.detectionCacheSize;
    }

    public static ConflictDetectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Rule count above which pairwise analysis is sharded across workers.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Whether non-critical pattern weaknesses are reported as conflicts.
     */
    public boolean isDeepAnalysis() {
        return deepAnalysis;
    }

    public int getDetectionCacheSize() {
        return detectionCacheSize;
    }

    public static final class Builder {
        private boolean parallel = true;
        private int workerCount = Math.min(4, Runtime.getRuntime().availableProcessors());
        private int parallelThreshold = 100;
        private boolean deepAnalysis = false;
        private int detectionCacheSize = 100;

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder deepAnalysis(boolean deepAnalysis) {
            this.deepAnalysis = deepAnalysis;
            return this;
        }

        public Builder detectionCacheSize(int detectionCacheSize) {
            this.detectionCacheSize = detectionCacheSize;
            return this;
        }

        public ConflictDetectionConfig build() {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workerCount must be positive, got: " + workerCount);
            }
            if (parallelThreshold < 0) {
                throw new IllegalArgumentException("parallelThreshold must be >= 0, got: " + parallelThreshold);
            }
            if (detectionCacheSize < 0) {
                throw new IllegalArgumentException("detectionCacheSize must be >= 0, got: " + detectionCacheSize);
            }
            return new ConflictDetectionConfig(this);
        }
    }
}
