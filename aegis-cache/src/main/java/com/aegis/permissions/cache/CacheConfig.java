/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Bounds of the {@link ValidationCache}: entry count, estimated memory and time-to-live.
 *
 * <p>The builder starts from the defaults (1000 entries, 50 MiB, 5 minutes) and then applies
 * environment overrides:
 * <pre>
 * AEGIS_CACHE_MAX_ENTRIES=5000
 * AEGIS_CACHE_MAX_MEMORY_MB=128
 * AEGIS_CACHE_TTL_SECONDS=600
 * </pre>
 * Values set explicitly on the builder win over the environment.
 */
public final class CacheConfig {

    private static final Logger logger = Logger.getLogger(CacheConfig.class.getName());

    private static final String ENV_MAX_ENTRIES = "AEGIS_CACHE_MAX_ENTRIES";
    private static final String ENV_MAX_MEMORY_MB = "AEGIS_CACHE_MAX_MEMORY_MB";
    private static final String ENV_TTL_SECONDS = "AEGIS_CACHE_TTL_SECONDS";

    private static final long MIB = 1024L * 1024L;

    private final int maxEntries;
    private final long maxMemoryBytes;
    private final Duration ttl;

    private CacheConfig(Builder builder) {
        this.maxEntries = builder.maxEntries;
        this.maxMemoryBytes = builder.maxMemoryBytes;
        this.ttl = builder.ttl;
        validate();
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    /**
     * Small, short-lived cache for local runs.
     */
    public static CacheConfig forDevelopment() {
        return builder()
                .maxEntries(100)
                .maxMemoryMb(10)
                .ttl(Duration.ofMinutes(1))
                .build();
    }

    public static CacheConfig forProduction() {
        return builder()
                .maxEntries(10_000)
                .maxMemoryMb(256)
                .ttl(Duration.ofMinutes(15))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public Duration getTtl() {
        return ttl;
    }

    private void validate() {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be positive: " + maxMemoryBytes);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    @Override
    public String toString() {
        return String.format("CacheConfig[maxEntries=%d, maxMemory=%d bytes, ttl=%s]", maxEntries, maxMemoryBytes, ttl);
    }

    public static final class Builder {
        private int maxEntries = 1_000;
        private long maxMemoryBytes = 50 * MIB;
        private Duration ttl = Duration.ofMinutes(5);

        private Builder() {
            getEnvLong(ENV_MAX_ENTRIES).ifPresent(val -> this.maxEntries = val.intValue());
            getEnvLong(ENV_MAX_MEMORY_MB).ifPresent(val -> this.maxMemoryBytes = val * MIB);
            getEnvLong(ENV_TTL_SECONDS).ifPresent(val -> this.ttl = Duration.ofSeconds(val));
        }

        public Builder maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder maxMemoryBytes(long bytes) {
            this.maxMemoryBytes = bytes;
            return this;
        }

        public Builder maxMemoryMb(long megabytes) {
            return maxMemoryBytes(megabytes * MIB);
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }

        private static Optional<Long> getEnvLong(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                return Optional.empty();
            }
            try {
                logger.fine("Loaded env var: " + key + "=" + value.trim());
                return Optional.of(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for " + key + ": " + value);
                return Optional.empty();
            }
        }
    }
}
