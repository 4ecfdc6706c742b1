package com.purchasingpower.recall.maintenance;

import java.time.Instant;

/**
 * Periodic self-maintenance of the graph: decay, deduplicate, prune, rerank.
 *
 * <p>A pass is deterministic for a given graph and {@code now}, and running it
 * twice with the same {@code now} changes nothing the first run did not.
 * Passes never overlap.
 *
 * @since 1.0.0
 */
public interface MaintenanceScheduler {

    /**
     * Run one pass, or finish an interrupted one. A resumed pass keeps its
     * original id and evaluation time.
     */
    MaintenanceReport runPass(Instant now);

    /**
     * Run a pass at the current time and persist the snapshot afterwards.
     */
    MaintenanceReport runAndPersist();
}
