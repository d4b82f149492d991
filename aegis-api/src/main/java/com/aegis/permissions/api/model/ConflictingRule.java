/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * A rule taking part in a conflict.
 *
 * @param category rule tier
 * @param pattern  pattern text as configured
 * @param location configuration path, e.g. {@code permissions.allow[0]}
 */
public record ConflictingRule(RuleCategory category, String pattern, String location) {

    public static ConflictingRule of(NormalizedRule rule) {
        return new ConflictingRule(rule.category(), rule.original(), rule.location());
    }
}
