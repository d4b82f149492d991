/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

public enum WeaknessType {
    TOO_BROAD("too-broad"),
    TRAVERSAL_RISK("traversal-risk"),
    ENCODING_VULNERABLE("encoding-vulnerable"),
    TOO_VAGUE("too-vague"),
    ESCAPE_PRONE("escape-prone");

    private final String label;

    WeaknessType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
