/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.model;

/**
 * Syntactic kind of a rule pattern.
 */
public enum PatternKind {
    /** Exact string comparison. */
    LITERAL,
    /** Shell-style wildcards: {@code *} and {@code ?}. */
    GLOB,
    /** Regular-expression syntax. */
    REGEX
}
