/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An already-loaded, already-merged permission configuration.
 *
 * <p>Rule lists may contain {@code null} entries; they are skipped during normalization.
 */
public record PermissionsConfig(
        List<String> deny,
        List<String> allow,
        List<String> ask,
        Map<String, Object> metadata
) {
    public PermissionsConfig {
        deny = copy(deny);
        allow = copy(allow);
        ask = copy(ask);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static PermissionsConfig of(List<String> deny, List<String> allow, List<String> ask) {
        return new PermissionsConfig(deny, allow, ask, null);
    }

    public static PermissionsConfig empty() {
        return new PermissionsConfig(null, null, null, null);
    }

    public List<String> rules(RuleCategory category) {
        switch (category) {
            case DENY:
                return deny;
            case ASK:
                return ask;
            case ALLOW:
                return allow;
            default:
                throw new IllegalArgumentException("Unknown category: " + category);
        }
    }

    /**
     * Returns a copy with one category's rules replaced.
     */
    public PermissionsConfig withRules(RuleCategory category, List<String> rules) {
        return new PermissionsConfig(
                category == RuleCategory.DENY ? rules : deny,
                category == RuleCategory.ALLOW ? rules : allow,
                category == RuleCategory.ASK ? rules : ask,
                metadata);
    }

    public int totalRules() {
        return deny.size() + allow.size() + ask.size();
    }

    private static List<String> copy(List<String> rules) {
        return rules == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rules));
    }
}
