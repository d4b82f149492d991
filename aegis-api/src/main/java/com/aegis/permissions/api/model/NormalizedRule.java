/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A rule after normalization: classified, compiled and placed in the precedence order.
 *
 * <p>Instances are rebuilt for every validation call and never mutated. Equality ignores the
 * compiled {@link Pattern} instance and compares its source expression instead.
 *
 * @param original       the pattern text exactly as configured
 * @param normalizedForm the expression actually matched (regex source for globs and regexes)
 * @param kind           literal, glob or regex
 * @param matcher        compiled matcher; for literals a quoted pattern
 * @param category       precedence tier
 * @param priority       evaluation priority; lower is evaluated first
 * @param index          position of the rule inside its category list
 */
public record NormalizedRule(
        String original,
        String normalizedForm,
        PatternKind kind,
        Pattern matcher,
        RuleCategory category,
        int priority,
        int index
) {
    public NormalizedRule {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(normalizedForm, "normalizedForm");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(category, "category");
    }

    /**
     * Tests a candidate input. Literals use exact equality, globs are anchored,
     * regexes use find semantics.
     */
    public boolean matches(String input) {
        if (kind == PatternKind.LITERAL) {
            return original.equals(input);
        }
        return matcher.matcher(input).find();
    }

    /**
     * Configuration path of this rule, e.g. {@code permissions.deny[2]}.
     */
    public String location() {
        return "permissions." + category.key() + "[" + index + "]";
    }

    /**
     * Content key {@code category:pattern}, used for content-addressed caching.
     */
    public String contentKey() {
        return category.key() + ":" + original;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedRule)) return false;
        NormalizedRule that = (NormalizedRule) o;
        return priority == that.priority
                && index == that.index
                && original.equals(that.original)
                && normalizedForm.equals(that.normalizedForm)
                && kind == that.kind
                && category == that.category
                && matcher.pattern().equals(that.matcher.pattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, normalizedForm, kind, category, priority, index);
    }

    @Override
    public String toString() {
        return category.key() + ":" + original + " (" + kind + ")";
    }
}
