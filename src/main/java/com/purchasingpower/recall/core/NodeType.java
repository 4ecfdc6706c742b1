package com.purchasingpower.recall.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Node types in the knowledge graph.
 *
 * <p>The set is closed: extraction payloads naming any other type are rejected
 * rather than mapped to a catch-all.
 *
 * @since 1.0.0
 */
public enum NodeType {
    CONCEPT,
    ENTITY,
    PERSON,
    TECHNOLOGY,
    FACT,
    PREFERENCE,
    SKILL,
    MISTAKE,
    QUESTION,
    TOPIC,
    FILE,
    EVENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node type is required");
        }
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
