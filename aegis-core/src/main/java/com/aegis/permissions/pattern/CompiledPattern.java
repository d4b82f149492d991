/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.pattern;

import com.aegis.permissions.api.model.PatternKind;

import java.util.regex.Pattern;

/**
 * Result of compiling one pattern string.
 *
 * @param kind            classification of the source text
 * @param normalizedForm  expression actually matched
 * @param pattern         compiled matcher
 * @param literalFallback true when a malformed regex was compiled as an escaped literal
 */
public record CompiledPattern(PatternKind kind, String normalizedForm, Pattern pattern, boolean literalFallback) {
}
