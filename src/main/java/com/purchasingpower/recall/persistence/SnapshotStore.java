package com.purchasingpower.recall.persistence;

import com.purchasingpower.recall.core.GraphSnapshot;

import java.util.Optional;

/**
 * Durable home of the graph snapshot and of the reflection pending marker.
 *
 * <p>A save either fully replaces the previous snapshot or leaves it untouched.
 *
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * @throws com.purchasingpower.recall.exception.PersistenceFailureException on I/O failure
     */
    void save(GraphSnapshot snapshot);

    /**
     * The last saved snapshot, empty if none was ever saved.
     *
     * @throws com.purchasingpower.recall.exception.PersistenceFailureException if it cannot be read
     */
    Optional<GraphSnapshot> load();

    void writeMarker(PendingReflectionMarker marker);

    Optional<PendingReflectionMarker> readMarker();

    void clearMarker();
}
