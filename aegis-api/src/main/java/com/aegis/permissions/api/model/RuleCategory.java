/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Locale;

/**
 * Precedence tier of a permission rule. Declaration order is evaluation precedence:
 * deny rules are consulted before ask rules, which are consulted before allow rules.
 */
public enum RuleCategory {
    DENY(-2 * RuleCategory.PRIORITY_BAND),
    ASK(-RuleCategory.PRIORITY_BAND),
    ALLOW(0);

    /**
     * Width of each category's priority range. Category ranges never overlap for lists shorter
     * than this, so every deny rule sorts before every ask rule regardless of list sizes.
     */
    public static final int PRIORITY_BAND = 1 << 29;

    private final int priorityBase;

    RuleCategory(int priorityBase) {
        this.priorityBase = priorityBase;
    }

    /**
     * Base value added to a rule's index to derive its evaluation priority.
     */
    public int priorityBase() {
        return priorityBase;
    }

    /**
     * Lower-case key as used in configuration documents ("deny", "ask", "allow").
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RuleCategory fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
