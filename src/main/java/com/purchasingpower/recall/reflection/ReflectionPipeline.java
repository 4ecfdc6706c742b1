package com.purchasingpower.recall.reflection;

/**
 * End-of-session reconciliation of the graph.
 *
 * <p>A cycle moves through {@link ReflectionState}: it reads the session's recent
 * interactions, asks the LLM for a synthesis, applies it as one transaction, runs
 * a maintenance pass and finally journals the session and saves the snapshot.
 * Saving the snapshot is the commit point. Only one cycle runs at a time.
 *
 * @since 1.0.0
 */
public interface ReflectionPipeline {

    /**
     * Run a cycle for the session. Returns {@link ReflectionOutcome#SKIPPED}
     * immediately when a cycle is already running.
     */
    ReflectionResult reflect(String sessionId);

    ReflectionState state();

    /**
     * Load the persisted snapshot into the store and settle any cycle that was
     * interrupted before its commit point, then re-index active nodes and
     * mistakes with the vector collaborator. Called once at startup.
     */
    void recover();

    /**
     * Ask the running cycle to stop at its next stage boundary.
     *
     * @return whether a cycle was running
     */
    boolean cancel();
}
