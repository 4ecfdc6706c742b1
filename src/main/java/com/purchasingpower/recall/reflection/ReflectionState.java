package com.purchasingpower.recall.reflection;

/**
 * Reflection cycle states.
 *
 * @since 1.0.0
 */
public enum ReflectionState {
    IDLE,
    COLLECTING,
    SYNTHESIZING,
    APPLYING,
    MAINTAINING,
    JOURNALING
}
