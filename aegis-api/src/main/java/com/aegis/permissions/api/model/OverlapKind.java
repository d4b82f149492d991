/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Relationship between the match sets of two patterns A and B.
 */
public enum OverlapKind {
    NONE("does not overlap with"),
    EXACT("exactly matches"),
    /** A matches a subset of what B matches. */
    SUBSET("is a subset of"),
    /** A matches a superset of what B matches. */
    SUPERSET("is a superset of"),
    PARTIAL("partially overlaps with");

    private final String phrase;

    OverlapKind(String phrase) {
        this.phrase = phrase;
    }

    /**
     * Human-readable relationship, phrased as "A {phrase} B".
     */
    public String phrase() {
        return phrase;
    }
}
