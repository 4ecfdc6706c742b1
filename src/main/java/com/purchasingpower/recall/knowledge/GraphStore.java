package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.core.ConfidenceOperator;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.core.GraphStats;
import com.purchasingpower.recall.core.KnowledgeEdge;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.MaintenanceCheckpoint;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Owner of all nodes and edges.
 *
 * <p>Every mutation is synchronous, enforces the graph invariants and returns
 * the post-state, so callers never need a read-after-write. Everything handed
 * out is a detached copy; callers keep ids, not references.
 *
 * <p>Implementations serialize mutations against each other and against reads.
 * Reads may run concurrently with other reads.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Node Operations
    // =========================================================================

    /**
     * Create a node, or resolve to the active node with the same type and
     * normalized label.
     *
     * <p>On resolution the existing node's use-counter is incremented and
     * attribute keys it does not have yet are copied over. No duplicate is created.
     *
     * @param type       node type
     * @param label      label text
     * @param attributes provenance attributes
     * @return id of the created or resolved node
     */
    String upsertNode(NodeType type, String label, Map<String, String> attributes);

    /**
     * Same as {@link #upsertNode(NodeType, String, Map)}, with the initial
     * confidence used when a node is created.
     */
    String upsertNode(NodeType type, String label, Map<String, String> attributes, double initialConfidence);

    /**
     * Get a node by id.
     *
     * @throws com.purchasingpower.recall.exception.NodeNotFoundException if absent
     */
    KnowledgeNode getNode(String nodeId);

    Optional<KnowledgeNode> findNode(String nodeId);

    /**
     * Find the active node with the given type and normalized label.
     */
    Optional<KnowledgeNode> findActiveByLabel(NodeType type, String label);

    /**
     * Find an active node with the given normalized label, any type.
     * Lowest creation order wins when several types share the label.
     */
    Optional<KnowledgeNode> findActiveByLabel(String label);

    List<KnowledgeNode> findNodesByType(NodeType type);

    List<KnowledgeNode> activeNodes();

    /**
     * Apply a confidence operator and return the new confidence.
     *
     * <p>A node whose confidence drops below the deprecation threshold becomes
     * deprecated. A deprecated node only accepts an explicit reinforcement, which
     * reactivates it once it is back at or above the threshold.
     *
     * @throws com.purchasingpower.recall.exception.NodeNotFoundException     if absent
     * @throws com.purchasingpower.recall.exception.InvalidOperatorException if the node cannot accept it
     */
    double applyConfidenceOp(String nodeId, ConfidenceOperator operator);

    /**
     * Charge decay from the node's watermark up to {@code now} and advance the
     * watermark. Calling it again with the same {@code now} changes nothing.
     * Deprecated nodes are left untouched.
     *
     * @return the node's confidence after decay
     */
    double applyDecay(String nodeId, Instant now);

    /**
     * Mark a node deprecated. Idempotent.
     *
     * @return post-state of the node
     */
    KnowledgeNode deprecate(String nodeId, String reason);

    /**
     * Tag a node with the maintenance pass that touched it.
     */
    void markPass(String nodeId, String passId);

    /**
     * Merge {@code dropId} into {@code keepId}: redirect every edge of the
     * dropped node, sum use-counters, copy missing attributes, record a
     * {@code similar_to} edge keep -> drop and deprecate the dropped node.
     *
     * @return post-state of the kept node
     */
    KnowledgeNode mergeNodes(String keepId, String dropId, String passId);

    // =========================================================================
    // Edge Operations
    // =========================================================================

    /**
     * Insert an edge, or strengthen the existing one for the same triple.
     *
     * <p>New edges start at {@link KnowledgeEdge#DEFAULT_WEIGHT}; repeated
     * insertion adds {@code weightDelta}.
     *
     * @return post-state of the edge
     */
    KnowledgeEdge addEdge(String sourceId, String targetId, RelationType relation, double weightDelta);

    KnowledgeEdge addEdge(String sourceId, String targetId, RelationType relation, double weightDelta,
                          Map<String, String> attributes);

    boolean removeEdge(String sourceId, String targetId, RelationType relation);

    /**
     * Edges incident to a node together with the node on the other end.
     *
     * @param relations relation filter, or null/empty for all
     */
    List<Neighbor> neighbors(String nodeId, RelationshipDirection direction, Set<RelationType> relations);

    List<KnowledgeEdge> edges();

    // =========================================================================
    // Whole-graph Operations
    // =========================================================================

    GraphSnapshot snapshot();

    /**
     * Replace the whole graph with the given snapshot after validating it.
     *
     * @throws com.purchasingpower.recall.exception.GraphIntegrityException if the snapshot violates an invariant
     */
    void restore(GraphSnapshot snapshot);

    /**
     * Run {@code work} as one unit. Other mutations and reads wait until it
     * completes; if it throws a runtime exception the graph is restored to the
     * state it had before.
     */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Run {@code work} while holding the store exclusively, without rollback.
     * Other threads' reads and mutations wait until it completes; the calling
     * thread may keep using the store, including {@link #inTransaction} and
     * {@link #restore}, from inside {@code work}.
     */
    <T> T exclusively(Supplier<T> work);

    Optional<MaintenanceCheckpoint> maintenanceCheckpoint();

    void updateMaintenanceCheckpoint(MaintenanceCheckpoint checkpoint);

    Optional<String> lastReflectedCycleId();

    void markReflected(String cycleId);

    GraphStats stats();
}
