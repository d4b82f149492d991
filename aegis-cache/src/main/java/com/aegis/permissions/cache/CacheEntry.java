/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.cache;

import com.aegis.permissions.api.model.ValidationResult;

/**
 * A cached validation result with its access bookkeeping. Times are epoch milliseconds.
 */
public record CacheEntry(
        ValidationResult result,
        String configHash,
        long createdAt,
        long accessCount,
        long lastAccessedAt,
        long estimatedSizeBytes
) {

    CacheEntry accessed(long now) {
        return new CacheEntry(result, configHash, createdAt, accessCount + 1, now, estimatedSizeBytes);
    }

    boolean isExpired(long now, long ttlMillis) {
        return now - createdAt > ttlMillis;
    }
}
