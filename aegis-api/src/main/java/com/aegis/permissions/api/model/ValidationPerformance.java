/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Timing of one validation call.
 *
 * @param elapsedMs      wall-clock duration
 * @param rulesProcessed number of normalized rules
 * @param targetMs       performance target in force
 * @param achieved       whether {@code elapsedMs < targetMs} and no deadline was exceeded
 */
public record ValidationPerformance(long elapsedMs, int rulesProcessed, long targetMs, boolean achieved) {
}
