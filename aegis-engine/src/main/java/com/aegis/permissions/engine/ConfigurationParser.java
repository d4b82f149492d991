/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.api.exception.ConfigurationParseException;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.ValidationWarning;
import com.aegis.permissions.api.model.ValidationWarningType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts loosely-typed configuration structures into {@link PermissionsConfig}.
 *
 * <p>Accepted shape: {@code {"permissions": {"deny": [...], "allow": [...], "ask": [...]}, "metadata": {...}}}.
 * Every key is optional. Entries that are not strings are reported as warnings and dropped
 * without shifting the indices of the entries after them.
 */
public final class ConfigurationParser {

    private static final Logger logger = Logger.getLogger(ConfigurationParser.class.getName());

    private static final String PERMISSIONS = "permissions";
    private static final String METADATA = "metadata";

    /**
     * Deepest container nesting accepted, matching Jackson's default read constraint.
     */
    static final int MAX_DEPTH = 1000;

    private final ObjectMapper mapper;

    public ConfigurationParser() {
        this(new ObjectMapper());
    }

    public ConfigurationParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ConfigurationParseException if the text is not a JSON object or has the wrong shape
     */
    public ParsedConfiguration parseJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationParseException("Configuration text is empty");
        }
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new ConfigurationParseException("Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
        return parse(raw);
    }

    /**
     * @throws ConfigurationParseException on null, circular, too deeply nested or wrongly shaped input
     */
    public ParsedConfiguration parse(Map<String, ?> raw) {
        if (raw == null) {
            throw new ConfigurationParseException("Configuration must not be null");
        }
        ensureAcyclic(raw, Collections.newSetFromMap(new IdentityHashMap<>()), "$", 0);

        List<ValidationWarning> warnings = new ArrayList<>();
        Map<RuleCategory, List<String>> rules = new LinkedHashMap<>();
        Object permissions = raw.get(PERMISSIONS);
        if (permissions != null) {
            if (!(permissions instanceof Map)) {
                throw new ConfigurationParseException(
                        "'permissions' must be an object but was " + typeName(permissions));
            }
            Map<?, ?> categories = (Map<?, ?>) permissions;
            for (RuleCategory category : RuleCategory.values()) {
                rules.put(category, readRules(category, categories.get(category.key()), warnings));
            }
        }

        Map<String, Object> metadata = readMetadata(raw.get(METADATA));
        PermissionsConfig config = new PermissionsConfig(
                rules.get(RuleCategory.DENY),
                rules.get(RuleCategory.ALLOW),
                rules.get(RuleCategory.ASK),
                metadata);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Parsed configuration: %d rules, %d warnings",
                    config.totalRules(), warnings.size()));
        }
        return new ParsedConfiguration(config, warnings);
    }

    private static List<String> readRules(RuleCategory category, Object value, List<ValidationWarning> warnings) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationParseException(String.format(
                    "'permissions.%s' must be an array but was %s", category.key(), typeName(value)));
        }
        List<?> entries = (List<?>) value;
        List<String> patterns = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (entry == null || entry instanceof String) {
                patterns.add((String) entry);
            } else {
                String location = "permissions." + category.key() + "[" + i + "]";
                warnings.add(ValidationWarning.of(ValidationWarningType.INVALID_PATTERN,
                        String.format("Non-string rule of type %s in %s rules ignored", typeName(entry),
                                category.key()),
                        location));
                // placeholder keeps later indices stable; the normalizer skips nulls
                patterns.add(null);
            }
        }
        return patterns;
    }

    private static Map<String, Object> readMetadata(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationParseException("'metadata' must be an object but was " + typeName(value));
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> metadata.put(String.valueOf(k), v));
        return metadata;
    }

    private static void ensureAcyclic(Object node, Set<Object> path, String where, int depth) {
        if (!(node instanceof Map) && !(node instanceof Iterable)) {
            return;
        }
        if (depth >= MAX_DEPTH) {
            throw new ConfigurationParseException(String.format(
                    "Configuration nesting exceeds maximum depth of %d at %s", MAX_DEPTH, where));
        }
        if (!path.add(node)) {
            throw new ConfigurationParseException("Circular reference in configuration at " + where);
        }
        if (node instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
                ensureAcyclic(entry.getValue(), path, where + "." + entry.getKey(), depth + 1);
            }
        } else {
            int i = 0;
            for (Object element : (Iterable<?>) node) {
                ensureAcyclic(element, path, where + "[" + i++ + "]", depth + 1);
            }
        }
        path.remove(node);
    }

    private static String typeName(Object value) {
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * A parsed configuration and the warnings raised while reading it.
     */
    public record ParsedConfiguration(PermissionsConfig config, List<ValidationWarning> warnings) {
        public ParsedConfiguration {
            warnings = List.copyOf(warnings);
        }
    }
}
