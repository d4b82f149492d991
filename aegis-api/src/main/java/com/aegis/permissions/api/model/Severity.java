/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Locale;

/**
 * Security impact of a conflict, weakness, issue or error. Declaration order is sort order,
 * most severe first.
 */
public enum Severity {
    CRITICAL(20),
    HIGH(10),
    MEDIUM(5),
    LOW(0);

    private final int scorePenalty;

    Severity(int scorePenalty) {
        this.scorePenalty = scorePenalty;
    }

    /**
     * Points deducted from a 0-100 security score for each issue of this severity.
     */
    public int scorePenalty() {
        return scorePenalty;
    }

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
