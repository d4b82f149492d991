/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Snapshot of validation-cache statistics.
 */
public record CacheStats(
        int entries,
        long hits,
        long misses,
        double hitRate,
        long memoryUsedBytes,
        long evictions,
        double averageRetrievalTimeMs,
        double averageValidationTimeMs
) {
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0.0, 0, 0, 0.0, 0.0);
    }

    public String format() {
        return String.format(
                "CacheStats[entries=%d, hits=%d, misses=%d, hitRate=%.2f%%, memory=%d bytes, evictions=%d]",
                entries, hits, misses, hitRate * 100, memoryUsedBytes, evictions);
    }
}
