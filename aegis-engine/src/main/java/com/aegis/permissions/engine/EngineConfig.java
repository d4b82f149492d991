/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.model.SecurityLevel;
import com.aegis.permissions.cache.CacheConfig;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Engine-wide settings. Per-call behaviour is controlled by
 * {@link com.aegis.permissions.api.model.ValidationOptions}.
 *
 * <p><b>Environment variables</b> read by {@link #fromEnvironment()}:
 * <pre>
 * AEGIS_MAX_WORKERS=8
 * AEGIS_CACHE_ENABLED=false
 * AEGIS_PERFORMANCE_TARGET_MS=250
 * AEGIS_STRICT_TIMEOUT=true
 * AEGIS_SECURITY_LEVEL=moderate
 * AEGIS_REQUIRE_DENY_RULES=true
 * AEGIS_DEEP_ANALYSIS=true
 * </pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    private static final String ENV_MAX_WORKERS = "AEGIS_MAX_WORKERS";
    private static final String ENV_CACHE_ENABLED = "AEGIS_CACHE_ENABLED";
    private static final String ENV_PERFORMANCE_TARGET_MS = "AEGIS_PERFORMANCE_TARGET_MS";
    private static final String ENV_STRICT_TIMEOUT = "AEGIS_STRICT_TIMEOUT";
    private static final String ENV_SECURITY_LEVEL = "AEGIS_SECURITY_LEVEL";
    private static final String ENV_REQUIRE_DENY_RULES = "AEGIS_REQUIRE_DENY_RULES";
    private static final String ENV_DEEP_ANALYSIS = "AEGIS_DEEP_ANALYSIS";

    private final int maxWorkers;
    private final boolean cacheEnabled;
    private final long performanceTargetMs;
    private final boolean strictTimeout;
    private final SecurityLevel securityLevel;
    private final boolean requireDenyRules;
    private final boolean deepAnalysis;
    private final int parallelThreshold;
    private final CacheConfig cacheConfig;

    private EngineConfig(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.cacheEnabled = builder.cacheEnabled;
        this.performanceTargetMs = builder.performanceTargetMs;
        this.strictTimeout = builder.strictTimeout;
        this.securityLevel = builder.securityLevel;
        this.requireDenyRules = builder.requireDenyRules;
        this.deepAnalysis = builder.deepAnalysis;
        this.parallelThreshold = builder.parallelThreshold;
        this.cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();
        validate();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Relaxed settings for local work: moderate security level and a generous target.
     */
    public static EngineConfig forDevelopment() {
        return builder()
                .securityLevel(SecurityLevel.MODERATE)
                .performanceTargetMs(500)
                .cacheConfig(CacheConfig.forDevelopment())
                .build();
    }

    public static EngineConfig forProduction() {
        return builder()
                .securityLevel(SecurityLevel.STRICT)
                .requireDenyRules(true)
                .cacheConfig(CacheConfig.forProduction())
                .build();
    }

    /**
     * Defaults overridden by the {@code AEGIS_*} environment variables that are set.
     */
    public static EngineConfig fromEnvironment() {
        Builder builder = builder();
        getEnvInt(ENV_MAX_WORKERS).ifPresent(builder::maxWorkers);
        getEnvBoolean(ENV_CACHE_ENABLED).ifPresent(builder::cacheEnabled);
        getEnvInt(ENV_PERFORMANCE_TARGET_MS).ifPresent(builder::performanceTargetMs);
        getEnvBoolean(ENV_STRICT_TIMEOUT).ifPresent(builder::strictTimeout);
        getEnv(ENV_SECURITY_LEVEL).ifPresent(val -> {
            try {
                builder.securityLevel(SecurityLevel.valueOf(val.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid security level for " + ENV_SECURITY_LEVEL + ": " + val);
            }
        });
        getEnvBoolean(ENV_REQUIRE_DENY_RULES).ifPresent(builder::requireDenyRules);
        getEnvBoolean(ENV_DEEP_ANALYSIS).ifPresent(builder::deepAnalysis);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getPerformanceTargetMs() {
        return performanceTargetMs;
    }

    /**
     * Whether an expired deadline stops validation instead of only marking the target missed.
     */
    public boolean isStrictTimeout() {
        return strictTimeout;
    }

    public SecurityLevel getSecurityLevel() {
        return securityLevel;
    }

    public boolean isRequireDenyRules() {
        return requireDenyRules;
    }

    public boolean isDeepAnalysis() {
        return deepAnalysis;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    private void validate() {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        if (performanceTargetMs <= 0) {
            throw new IllegalArgumentException("performanceTargetMs must be positive: " + performanceTargetMs);
        }
        if (parallelThreshold < 0) {
            throw new IllegalArgumentException("parallelThreshold must be >= 0: " + parallelThreshold);
        }
        if (securityLevel == null) {
            throw new IllegalArgumentException("securityLevel is required");
        }
    }

    @Override
    public String toString() {
        return String.format(
                "EngineConfig[maxWorkers=%d, cache=%s, targetMs=%d, strictTimeout=%s, level=%s, requireDeny=%s, deep=%s]",
                maxWorkers, cacheEnabled, performanceTargetMs, strictTimeout, securityLevel, requireDenyRules,
                deepAnalysis);
    }

    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded env var: " + key + "=" + value.trim());
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static Optional<Integer> getEnvInt(String key) {
        return getEnv(key).flatMap(val -> {
            try {
                return Optional.of(Integer.parseInt(val));
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + key + ": " + val);
                return Optional.empty();
            }
        });
    }

    private static Optional<Boolean> getEnvBoolean(String key) {
        return getEnv(key).map(val -> {
            String normalized = val.toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        });
    }

    public static final class Builder {
        private int maxWorkers = Math.min(4, Runtime.getRuntime().availableProcessors());
        private boolean cacheEnabled = true;
        private long performanceTargetMs = 100;
        private boolean strictTimeout = false;
        private SecurityLevel securityLevel = SecurityLevel.STRICT;
        private boolean requireDenyRules = false;
        private boolean deepAnalysis = false;
        private int parallelThreshold = 100;
        private CacheConfig cacheConfig;

        private Builder() {
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder performanceTargetMs(long targetMs) {
            this.performanceTargetMs = targetMs;
            return this;
        }

        public Builder strictTimeout(boolean strictTimeout) {
            this.strictTimeout = strictTimeout;
            return this;
        }

        public Builder securityLevel(SecurityLevel securityLevel) {
            this.securityLevel = securityLevel;
            return this;
        }

        public Builder requireDenyRules(boolean requireDenyRules) {
            this.requireDenyRules = requireDenyRules;
            return this;
        }

        public Builder deepAnalysis(boolean deepAnalysis) {
            this.deepAnalysis = deepAnalysis;
            return this;
        }

        /**
         * Rule count above which pairwise conflict analysis is sharded across workers.
         */
        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
