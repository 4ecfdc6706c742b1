package com.purchasingpower.recall.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a node.
 *
 * @since 1.0.0
 */
public enum NodeStatus {
    ACTIVE,
    DEPRECATED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeStatus fromValue(String value) {
        return NodeStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
