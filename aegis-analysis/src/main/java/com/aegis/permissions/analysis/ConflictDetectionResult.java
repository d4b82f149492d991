/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.Overlap;
import com.aegis.permissions.api.model.Severity;

import java.util.List;

/**
 * Output of one detection run.
 *
 * @param conflicts       deduplicated conflicts, most severe first
 * @param overlaps        every non-empty overlap found by the pairwise passes
 * @param pairsAnalyzed   number of rule pairs compared
 * @param detectionTimeMs wall-clock time of the run
 * @param fromCache       whether this result was served from the detection cache
 */
public record ConflictDetectionResult(
        List<Conflict> conflicts,
        List<Overlap> overlaps,
        long pairsAnalyzed,
        double detectionTimeMs,
        boolean fromCache
) {
    public ConflictDetectionResult {
        conflicts = List.copyOf(conflicts);
        overlaps = List.copyOf(overlaps);
    }

    ConflictDetectionResult asCached() {
        return new ConflictDetectionResult(conflicts, overlaps, pairsAnalyzed, detectionTimeMs, true);
    }

    public long countBySeverity(Severity severity) {
        return conflicts.stream().filter(c -> c.securityImpact() == severity).count();
    }
}
