/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api;

import com.aegis.permissions.api.model.BatchValidationResult;
import com.aegis.permissions.api.model.CacheStats;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.RuleStatistics;
import com.aegis.permissions.api.model.ValidationOptions;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.api.model.ValidationState;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the permission validation core.
 *
 * <p>The {@code validate} family never throws: every failure is encoded in the returned
 * {@link ValidationResult}.
 */
public interface IValidationEngine extends AutoCloseable {

    ValidationResult validate(PermissionsConfig config, ValidationOptions options);

    default ValidationResult validate(PermissionsConfig config) {
        return validate(config, ValidationOptions.defaults());
    }

    /**
     * Validates a raw, loosely-typed configuration structure, as produced by a JSON or YAML loader.
     */
    ValidationResult validate(Map<String, ?> rawConfig, ValidationOptions options);

    /**
     * Validates configuration JSON text.
     */
    ValidationResult validateJson(String json, ValidationOptions options);

    /**
     * Validates several configurations concurrently. Results keep the input order; a {@code null}
     * element yields a failed result in its slot.
     *
     * @throws NullPointerException if {@code configs} is null
     */
    BatchValidationResult validateBatch(String id, List<PermissionsConfig> configs, ValidationOptions options);

    /**
     * Computes static statistics. Does not touch the cache.
     */
    RuleStatistics getRuleStatistics(PermissionsConfig config);

    String exportCache();

    /**
     * @throws com.aegis.permissions.api.exception.CacheImportException on malformed data or a version mismatch
     */
    void importCache(String serialized);

    CacheStats getCacheStats();

    ValidationState getState();

    @Override
    void close();
}
