/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.List;

/**
 * Outcome of validating several configurations in one call. Results keep input order.
 */
public record BatchValidationResult(
        String id,
        List<ValidationResult> results,
        long totalTimeMs,
        int successCount,
        int failureCount
) {
    public BatchValidationResult {
        results = List.copyOf(results);
    }

    public static BatchValidationResult of(String id, List<ValidationResult> results, long totalTimeMs) {
        int success = (int) results.stream().filter(ValidationResult::valid).count();
        return new BatchValidationResult(id, results, totalTimeMs, success, results.size() - success);
    }
}
