/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A concrete edit to one rule list of a configuration.
 *
 * <p>Closed set of variants; each carries only the fields its action needs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Change.Add.class, name = "ADD"),
        @JsonSubTypes.Type(value = Change.Remove.class, name = "REMOVE"),
        @JsonSubTypes.Type(value = Change.Modify.class, name = "MODIFY"),
        @JsonSubTypes.Type(value = Change.Reorder.class, name = "REORDER")
})
public sealed interface Change permits Change.Add, Change.Remove, Change.Modify, Change.Reorder {

    RuleCategory category();

    String reason();

    ChangeAction action();

    /**
     * Adds {@code pattern} at {@code position}, or at the end when position is null.
     */
    record Add(RuleCategory category, String pattern, Integer position, String reason) implements Change {
        @Override
        public ChangeAction action() {
            return ChangeAction.ADD;
        }
    }

    record Remove(RuleCategory category, String pattern, String reason) implements Change {
        @Override
        public ChangeAction action() {
            return ChangeAction.REMOVE;
        }
    }

    record Modify(RuleCategory category, String originalPattern, String newPattern, String reason)
            implements Change {
        @Override
        public ChangeAction action() {
            return ChangeAction.MODIFY;
        }
    }

    record Reorder(RuleCategory category, String pattern, int newPosition, String reason) implements Change {
        @Override
        public ChangeAction action() {
            return ChangeAction.REORDER;
        }
    }
}
