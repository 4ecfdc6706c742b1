package com.purchasingpower.recall.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Relation types for directed edges.
 *
 * @since 1.0.0
 */
public enum RelationType {

    // Semantic
    IS_A,
    HAS_PROPERTY,
    PART_OF,
    RELATES_TO,
    DEPENDS_ON,
    CAUSES,
    USED_IN,
    SIMILAR_TO,

    // Knowledge quality
    CONTRADICTS,
    SUPPORTS,
    CORRECTS,

    // User
    PREFERRED_BY,
    KNOWS,
    DISLIKES,

    // Provenance
    EXTRACTED_FROM,
    INFERRED_FROM,
    MENTIONED_IN,

    // Structural
    AUTHORED_BY,
    CONTAINS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RelationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Relation type is required");
        }
        return RelationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
