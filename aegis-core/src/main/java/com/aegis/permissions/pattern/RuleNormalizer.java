/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.RuleCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a configuration into its ordered list of normalized rules: deny rules first, then ask,
 * then allow, each keeping its configured order and index. {@code null} entries are skipped
 * without shifting the indices of the entries after them.
 */
public final class RuleNormalizer {

    private final PatternEngine patternEngine;

    public RuleNormalizer(PatternEngine patternEngine) {
        this.patternEngine = patternEngine;
    }

    public List<NormalizedRule> normalize(PermissionsConfig config) {
        List<NormalizedRule> rules = new ArrayList<>(config.totalRules());
        for (RuleCategory category : RuleCategory.values()) {
            List<String> patterns = config.rules(category);
            for (int index = 0; index < patterns.size(); index++) {
                String pattern = patterns.get(index);
                if (pattern != null) {
                    rules.add(patternEngine.normalize(pattern, category, index));
                }
            }
        }
        return rules;
    }
}
