/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import java.util.List;

/**
 * Per-call detection options.
 *
 * @param skipCache      ignore and do not populate the detection cache
 * @param zeroBypassOnly run only the zero-bypass pass
 * @param deepAnalysis   report non-critical weaknesses in addition to the engine default
 * @param parallel       allow sharding of the pairwise pass
 * @param workerCount    shard count; 0 uses the engine default
 * @param extraProbes    additional inputs for overlap analysis
 */
public record DetectionOptions(
        boolean skipCache,
        boolean zeroBypassOnly,
        boolean deepAnalysis,
        boolean parallel,
        int workerCount,
        List<String> extraProbes
) {
    private static final DetectionOptions DEFAULTS =
            new DetectionOptions(false, false, false, true, 0, List.of());

    public DetectionOptions {
        extraProbes = extraProbes == null ? List.of() : List.copyOf(extraProbes);
    }

    public static DetectionOptions defaults() {
        return DEFAULTS;
    }
}
