package com.purchasingpower.recall.reflection;

/**
 * How a reflection cycle ended.
 *
 * @since 1.0.0
 */
public enum ReflectionOutcome {
    /** Snapshot saved with the cycle's mutations. */
    COMMITTED,
    /** Stopped before touching the graph. */
    ABORTED,
    /** Another cycle was running. */
    SKIPPED,
    /** Failed after mutations began; the graph was restored. */
    ROLLED_BACK
}
