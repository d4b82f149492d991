/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.cache;

import com.aegis.permissions.api.exception.ValidationException;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Content hash of a configuration.
 *
 * <p>The configuration is canonicalized first: object keys are sorted, {@code metadata} and
 * {@code timestamp} fields are dropped and array contents are sorted. Configurations that differ
 * only in formatting, key order, rule order or metadata hash to the same SHA-256 digest.
 */
public final class ConfigurationHasher {

    private static final Set<String> IGNORED_FIELDS = Set.of("metadata", "timestamp");

    private final ObjectMapper mapper;

    public ConfigurationHasher() {
        this(new ObjectMapper());
    }

    public ConfigurationHasher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String hash(PermissionsConfig config) {
        return hash((JsonNode) mapper.valueToTree(config));
    }

    public String hash(JsonNode tree) {
        return Hashing.sha256()
                .hashString(canonicalJson(tree), StandardCharsets.UTF_8)
                .toString();
    }

    String canonicalJson(JsonNode tree) {
        try {
            return mapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Failed to canonicalize configuration: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            TreeSet<String> names = new TreeSet<>();
            node.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (!IGNORED_FIELDS.contains(name)) {
                    sorted.set(name, canonicalize(node.get(name)));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                elements.add(canonicalize(it.next()));
            }
            elements.sort(Comparator.comparing(JsonNode::toString));
            ArrayNode array = JsonNodeFactory.instance.arrayNode(elements.size());
            elements.forEach(array::add);
            return array;
        }
        return node;
    }
}
