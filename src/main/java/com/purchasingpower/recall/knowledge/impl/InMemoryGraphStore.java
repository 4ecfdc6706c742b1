package com.purchasingpower.recall.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.recall.core.ConfidenceOperator;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.core.GraphStats;
import com.purchasingpower.recall.core.KnowledgeEdge;
import com.purchasingpower.recall.core.KnowledgeEdge.EdgeKey;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.MaintenanceCheckpoint;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.core.NodeStatus;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.GraphIntegrityException;
import com.purchasingpower.recall.exception.InvalidOperatorException;
import com.purchasingpower.recall.exception.NodeNotFoundException;
import com.purchasingpower.recall.knowledge.ConfidenceEngine;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.LabelNormalizer;
import com.purchasingpower.recall.knowledge.RelationshipDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Arena-style graph store: nodes keyed by id, edges keyed by their
 * (source, target, relation) triple, adjacency kept as sets of edge keys.
 *
 * <p>All state is guarded by one read/write lock. The write lock is reentrant,
 * so {@link #inTransaction(Supplier)} can call the other mutators.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class InMemoryGraphStore implements GraphStore {

    public static final String ATTR_DEPRECATION_REASON = "deprecationReason";
    public static final String ATTR_MERGED_INTO = "mergedInto";

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, KnowledgeNode> nodes = new LinkedHashMap<>();
    private final Map<String, String> activeLabelIndex = new HashMap<>();
    private final Map<EdgeKey, KnowledgeEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> outgoing = new HashMap<>();
    private final Map<String, Set<EdgeKey>> incoming = new HashMap<>();

    private MaintenanceCheckpoint checkpoint;
    private String lastMaintenancePassId;
    private String lastReflectedCycleId;

    public InMemoryGraphStore(Clock clock) {
        this.clock = clock;
    }

    // =========================================================================
    // Node Operations
    // =========================================================================

    @Override
    public String upsertNode(NodeType type, String label, Map<String, String> attributes) {
        return upsertNode(type, label, attributes, ConfidenceEngine.INITIAL_CONFIDENCE);
    }

    @Override
    public String upsertNode(NodeType type, String label, Map<String, String> attributes, double initialConfidence) {
        Preconditions.checkNotNull(type, "Node type is required");
        Preconditions.checkArgument(label != null && !label.isBlank(), "Node label is required");

        lock.writeLock().lock();
        try {
            String key = labelKey(type, label);
            String existingId = activeLabelIndex.get(key);
            if (existingId != null) {
                KnowledgeNode existing = nodes.get(existingId);
                existing.setUseCount(existing.getUseCount() + 1);
                if (attributes != null) {
                    attributes.forEach(existing.getAttributes()::putIfAbsent);
                }
                log.debug("Node resolved: [{}] '{}' (uses={})", type.value(), existing.getLabel(), existing.getUseCount());
                return existingId;
            }

            Instant now = clock.instant();
            KnowledgeNode node = KnowledgeNode.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .label(label.trim())
                .confidence(ConfidenceEngine.clamp(initialConfidence))
                .createdAt(now)
                .updatedAt(now)
                .lastDecayAt(now)
                .status(NodeStatus.ACTIVE)
                .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
                .build();

            nodes.put(node.getId(), node);
            activeLabelIndex.put(key, node.getId());
            log.debug("Node added: [{}] '{}' (id={})", type.value(), node.getLabel(), node.getId());
            return node.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public KnowledgeNode getNode(String nodeId) {
        return findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    @Override
    public Optional<KnowledgeNode> findNode(String nodeId) {
        lock.readLock().lock();
        try {
            KnowledgeNode node = nodeId != null ? nodes.get(nodeId) : null;
            return Optional.ofNullable(node).map(KnowledgeNode::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<KnowledgeNode> findActiveByLabel(NodeType type, String label) {
        lock.readLock().lock();
        try {
            String id = activeLabelIndex.get(labelKey(type, label));
            return Optional.ofNullable(id).map(nodes::get).map(KnowledgeNode::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<KnowledgeNode> findActiveByLabel(String label) {
        String normalized = LabelNormalizer.normalize(label);
        lock.readLock().lock();
        try {
            return nodes.values().stream()
                .filter(KnowledgeNode::isActive)
                .filter(n -> LabelNormalizer.normalize(n.getLabel()).equals(normalized))
                .findFirst()
                .map(KnowledgeNode::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<KnowledgeNode> findNodesByType(NodeType type) {
        lock.readLock().lock();
        try {
            return nodes.values().stream()
                .filter(n -> n.getType() == type)
                .map(KnowledgeNode::copy)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<KnowledgeNode> activeNodes() {
        lock.readLock().lock();
        try {
            return nodes.values().stream()
                .filter(KnowledgeNode::isActive)
                .map(KnowledgeNode::copy)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double applyConfidenceOp(String nodeId, ConfidenceOperator operator) {
        Preconditions.checkNotNull(operator, "Operator is required");

        lock.writeLock().lock();
        try {
            KnowledgeNode node = require(nodeId);
            boolean reactivating = !node.isActive();

            if (reactivating) {
                if (!operator.isExplicitReinforcement()) {
                    log.warn("Rejected {} on deprecated node '{}'", operator.kind(), node.getLabel());
                    throw new InvalidOperatorException(nodeId, operator.kind(), "node is deprecated");
                }
                String mergedInto = node.getAttributes().get(ATTR_MERGED_INTO);
                if (mergedInto != null) {
                    throw new InvalidOperatorException(nodeId, operator.kind(), "node was merged into " + mergedInto);
                }
                String activeTwin = activeLabelIndex.get(labelKey(node.getType(), node.getLabel()));
                if (activeTwin != null) {
                    throw new InvalidOperatorException(nodeId, operator.kind(), "active node " + activeTwin + " has the same label");
                }
            }

            double next = checkBounds(nodeId, ConfidenceEngine.apply(node.getConfidence(), operator));
            node.setConfidence(next);

            Instant now = clock.instant();
            if (operator.kind() == ConfidenceOperator.Kind.DECAY) {
                node.setLastDecayAt(now);
            } else {
                node.setUpdatedAt(now);
            }

            if (reactivating) {
                if (!ConfidenceEngine.isBelowThreshold(next)) {
                    node.setStatus(NodeStatus.ACTIVE);
                    node.getAttributes().remove(ATTR_DEPRECATION_REASON);
                    activeLabelIndex.put(labelKey(node.getType(), node.getLabel()), node.getId());
                    log.info("Node reactivated: '{}' (conf={})", node.getLabel(), String.format("%.3f", next));
                }
            } else if (ConfidenceEngine.isBelowThreshold(next)) {
                markDeprecated(node, String.format("confidence below threshold (%.3f)", next));
            }

            log.debug("{} on '{}' -> {}", operator.kind(), node.getLabel(), String.format("%.3f", next));
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public double applyDecay(String nodeId, Instant now) {
        Preconditions.checkNotNull(now, "Decay time is required");

        lock.writeLock().lock();
        try {
            KnowledgeNode node = require(nodeId);
            if (!node.isActive()) {
                return node.getConfidence();
            }

            double days = ConfidenceEngine.elapsedDays(node, now);
            if (days <= 0.0) {
                return node.getConfidence();
            }

            double next = checkBounds(nodeId, ConfidenceEngine.apply(node.getConfidence(), ConfidenceOperator.decay(days)));
            node.setConfidence(next);
            node.setLastDecayAt(now);

            if (ConfidenceEngine.isBelowThreshold(next)) {
                markDeprecated(node, String.format("confidence below threshold (%.3f)", next));
            }
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public KnowledgeNode deprecate(String nodeId, String reason) {
        lock.writeLock().lock();
        try {
            KnowledgeNode node = require(nodeId);
            if (node.isActive()) {
                markDeprecated(node, reason);
            }
            return node.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void markPass(String nodeId, String passId) {
        lock.writeLock().lock();
        try {
            require(nodeId).setLastPassId(passId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public KnowledgeNode mergeNodes(String keepId, String dropId, String passId) {
        Preconditions.checkArgument(!keepId.equals(dropId), "Cannot merge a node into itself: %s", keepId);

        lock.writeLock().lock();
        try {
            KnowledgeNode keep = require(keepId);
            KnowledgeNode drop = require(dropId);

            if (!drop.isActive()) {
                return keep.copy();
            }
            if (!keep.isActive()) {
                throw new GraphIntegrityException("Cannot merge into deprecated node " + keepId);
            }

            for (EdgeKey key : new ArrayList<>(outgoing.getOrDefault(dropId, Set.of()))) {
                KnowledgeEdge edge = removeEdgeInternal(key);
                if (!edge.getTarget().equals(keepId)) {
                    redirect(edge, keepId, edge.getTarget());
                }
            }
            for (EdgeKey key : new ArrayList<>(incoming.getOrDefault(dropId, Set.of()))) {
                KnowledgeEdge edge = removeEdgeInternal(key);
                if (!edge.getSource().equals(keepId)) {
                    redirect(edge, edge.getSource(), keepId);
                }
            }

            keep.setUseCount(keep.getUseCount() + drop.getUseCount());
            drop.getAttributes().forEach((k, v) -> {
                if (!ATTR_DEPRECATION_REASON.equals(k) && !ATTR_MERGED_INTO.equals(k)) {
                    keep.getAttributes().putIfAbsent(k, v);
                }
            });
            keep.setLastPassId(passId);

            Map<String, String> mergeAttributes = new LinkedHashMap<>();
            mergeAttributes.put("reason", "merged");
            if (passId != null) {
                mergeAttributes.put("passId", passId);
            }
            putEdge(keepId, dropId, RelationType.SIMILAR_TO, KnowledgeEdge.DEFAULT_WEIGHT, clock.instant(), mergeAttributes);

            drop.getAttributes().put(ATTR_MERGED_INTO, keepId);
            drop.setLastPassId(passId);
            markDeprecated(drop, "merged into '" + keep.getLabel() + "'");

            log.info("Merged '{}' -> '{}' (uses={})", drop.getLabel(), keep.getLabel(), keep.getUseCount());
            return keep.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =========================================================================
    // Edge Operations
    // =========================================================================

    @Override
    public KnowledgeEdge addEdge(String sourceId, String targetId, RelationType relation, double weightDelta) {
        return addEdge(sourceId, targetId, relation, weightDelta, Map.of());
    }

    @Override
    public KnowledgeEdge addEdge(String sourceId, String targetId, RelationType relation, double weightDelta,
                                 Map<String, String> attributes) {
        Preconditions.checkNotNull(relation, "Relation is required");
        Preconditions.checkArgument(weightDelta >= 0.0 && Double.isFinite(weightDelta),
            "Weight delta must be a finite non-negative number, got %s", weightDelta);

        lock.writeLock().lock();
        try {
            require(sourceId);
            require(targetId);
            Preconditions.checkArgument(!sourceId.equals(targetId), "Self-loop edges are not allowed: %s", sourceId);

            EdgeKey key = new EdgeKey(sourceId, targetId, relation);
            KnowledgeEdge existing = edges.get(key);
            if (existing != null) {
                existing.setWeight(existing.getWeight() + weightDelta);
                if (attributes != null) {
                    attributes.forEach(existing.getAttributes()::putIfAbsent);
                }
                return existing.copy();
            }
            return putEdge(sourceId, targetId, relation, KnowledgeEdge.DEFAULT_WEIGHT, clock.instant(), attributes).copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean removeEdge(String sourceId, String targetId, RelationType relation) {
        lock.writeLock().lock();
        try {
            EdgeKey key = new EdgeKey(sourceId, targetId, relation);
            if (!edges.containsKey(key)) {
                return false;
            }
            removeEdgeInternal(key);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Neighbor> neighbors(String nodeId, RelationshipDirection direction, Set<RelationType> relations) {
        lock.readLock().lock();
        try {
            require(nodeId);
            List<Neighbor> result = new ArrayList<>();
            if (direction == RelationshipDirection.OUTGOING || direction == RelationshipDirection.BOTH) {
                for (EdgeKey key : outgoing.getOrDefault(nodeId, Set.of())) {
                    addNeighbor(result, edges.get(key), key.target(), relations);
                }
            }
            if (direction == RelationshipDirection.INCOMING || direction == RelationshipDirection.BOTH) {
                for (EdgeKey key : incoming.getOrDefault(nodeId, Set.of())) {
                    addNeighbor(result, edges.get(key), key.source(), relations);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<KnowledgeEdge> edges() {
        lock.readLock().lock();
        try {
            return edges.values().stream().map(KnowledgeEdge::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    // =========================================================================
    // Whole-graph Operations
    // =========================================================================

    @Override
    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return captureState();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void restore(GraphSnapshot snapshot) {
        validate(snapshot);
        lock.writeLock().lock();
        try {
            replaceState(snapshot);
            log.info("Graph restored: {} nodes, {} edges", nodes.size(), edges.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            GraphSnapshot before = captureState();
            try {
                return work.get();
            } catch (RuntimeException e) {
                replaceState(before);
                log.warn("Transaction rolled back: {}", e.getMessage());
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T exclusively(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<MaintenanceCheckpoint> maintenanceCheckpoint() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(checkpoint).map(MaintenanceCheckpoint::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateMaintenanceCheckpoint(MaintenanceCheckpoint checkpoint) {
        lock.writeLock().lock();
        try {
            this.checkpoint = checkpoint != null ? checkpoint.copy() : null;
            if (checkpoint != null && checkpoint.isCompleted()) {
                this.lastMaintenancePassId = checkpoint.getPassId();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<String> lastReflectedCycleId() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastReflectedCycleId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void markReflected(String cycleId) {
        lock.writeLock().lock();
        try {
            this.lastReflectedCycleId = cycleId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public GraphStats stats() {
        lock.readLock().lock();
        try {
            List<KnowledgeNode> active = nodes.values().stream()
                .filter(KnowledgeNode::isActive)
                .collect(Collectors.toList());

            Map<String, Integer> types = new TreeMap<>();
            active.forEach(n -> types.merge(n.getType().value(), 1, Integer::sum));

            double average = active.stream().mapToDouble(KnowledgeNode::getConfidence).average().orElse(0.0);
            int contradictions = (int) edges.keySet().stream()
                .filter(k -> k.relation() == RelationType.CONTRADICTS)
                .count();

            return GraphStats.builder()
                .totalNodes(nodes.size())
                .activeNodes(active.size())
                .deprecatedNodes(nodes.size() - active.size())
                .totalEdges(edges.size())
                .averageConfidence(Math.round(average * 1000.0) / 1000.0)
                .contradictions(contradictions)
                .nodeTypes(types)
                .lastMaintenancePassId(lastMaintenancePassId)
                .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // =========================================================================
    // Internals (callers hold the write lock)
    // =========================================================================

    private KnowledgeNode require(String nodeId) {
        KnowledgeNode node = nodeId != null ? nodes.get(nodeId) : null;
        if (node == null) {
            throw new NodeNotFoundException(nodeId);
        }
        return node;
    }

    private static String labelKey(NodeType type, String label) {
        return type.value() + "|" + LabelNormalizer.normalize(label);
    }

    private static double checkBounds(String nodeId, double confidence) {
        if (confidence < ConfidenceEngine.MIN_CONFIDENCE || confidence > ConfidenceEngine.MAX_CONFIDENCE) {
            throw new GraphIntegrityException("Confidence " + confidence + " out of bounds for node " + nodeId);
        }
        return confidence;
    }

    private void markDeprecated(KnowledgeNode node, String reason) {
        node.setStatus(NodeStatus.DEPRECATED);
        if (reason != null) {
            node.getAttributes().put(ATTR_DEPRECATION_REASON, reason);
        }
        activeLabelIndex.remove(labelKey(node.getType(), node.getLabel()), node.getId());
        log.info("Node deprecated: '{}' ({})", node.getLabel(), reason);
    }

    private void addNeighbor(List<Neighbor> result, KnowledgeEdge edge, String otherId, Set<RelationType> relations) {
        if (relations != null && !relations.isEmpty() && !relations.contains(edge.getRelation())) {
            return;
        }
        result.add(new Neighbor(edge.copy(), nodes.get(otherId).copy()));
    }

    private KnowledgeEdge putEdge(String sourceId, String targetId, RelationType relation, double weight,
                                  Instant createdAt, Map<String, String> attributes) {
        EdgeKey key = new EdgeKey(sourceId, targetId, relation);
        if (edges.containsKey(key)) {
            throw new GraphIntegrityException("Duplicate edge " + key);
        }
        KnowledgeEdge edge = KnowledgeEdge.builder()
            .source(sourceId)
            .target(targetId)
            .relation(relation)
            .weight(weight)
            .createdAt(createdAt)
            .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
            .build();
        edges.put(key, edge);
        outgoing.computeIfAbsent(sourceId, k -> new LinkedHashSet<>()).add(key);
        incoming.computeIfAbsent(targetId, k -> new LinkedHashSet<>()).add(key);
        return edge;
    }

    private KnowledgeEdge removeEdgeInternal(EdgeKey key) {
        KnowledgeEdge edge = edges.remove(key);
        Set<EdgeKey> out = outgoing.get(key.source());
        if (out != null) {
            out.remove(key);
        }
        Set<EdgeKey> in = incoming.get(key.target());
        if (in != null) {
            in.remove(key);
        }
        return edge;
    }

    private void redirect(KnowledgeEdge edge, String sourceId, String targetId) {
        EdgeKey key = new EdgeKey(sourceId, targetId, edge.getRelation());
        KnowledgeEdge existing = edges.get(key);
        if (existing != null) {
            existing.setWeight(existing.getWeight() + edge.getWeight());
            edge.getAttributes().forEach(existing.getAttributes()::putIfAbsent);
        } else {
            putEdge(sourceId, targetId, edge.getRelation(), edge.getWeight(), edge.getCreatedAt(), edge.getAttributes());
        }
    }

    private GraphSnapshot captureState() {
        return GraphSnapshot.builder()
            .version(GraphSnapshot.CURRENT_VERSION)
            .lastMaintenancePassId(lastMaintenancePassId)
            .maintenanceCheckpoint(checkpoint != null ? checkpoint.copy() : null)
            .lastReflectedCycleId(lastReflectedCycleId)
            .nodes(nodes.values().stream().map(KnowledgeNode::copy).collect(Collectors.toList()))
            .edges(edges.values().stream().map(KnowledgeEdge::copy).collect(Collectors.toList()))
            .build();
    }

    private void replaceState(GraphSnapshot snapshot) {
        nodes.clear();
        activeLabelIndex.clear();
        edges.clear();
        outgoing.clear();
        incoming.clear();

        for (KnowledgeNode node : snapshot.getNodes()) {
            KnowledgeNode copy = node.copy();
            nodes.put(copy.getId(), copy);
            if (copy.isActive()) {
                activeLabelIndex.putIfAbsent(labelKey(copy.getType(), copy.getLabel()), copy.getId());
            }
        }
        for (KnowledgeEdge edge : snapshot.getEdges()) {
            putEdge(edge.getSource(), edge.getTarget(), edge.getRelation(), edge.getWeight(),
                edge.getCreatedAt(), edge.getAttributes());
        }

        checkpoint = snapshot.getMaintenanceCheckpoint() != null ? snapshot.getMaintenanceCheckpoint().copy() : null;
        lastMaintenancePassId = snapshot.getLastMaintenancePassId();
        lastReflectedCycleId = snapshot.getLastReflectedCycleId();
    }

    private static void validate(GraphSnapshot snapshot) {
        Preconditions.checkNotNull(snapshot, "Snapshot is required");
        if (snapshot.getVersion() > GraphSnapshot.CURRENT_VERSION) {
            throw new GraphIntegrityException("Unsupported snapshot version " + snapshot.getVersion());
        }

        Set<String> ids = new HashSet<>();
        for (KnowledgeNode node : snapshot.getNodes()) {
            if (node.getId() == null || node.getType() == null || node.getLabel() == null || node.getStatus() == null) {
                throw new GraphIntegrityException("Incomplete node record: " + node.getId());
            }
            if (!ids.add(node.getId())) {
                throw new GraphIntegrityException("Duplicate node id " + node.getId());
            }
            double confidence = node.getConfidence();
            if (Double.isNaN(confidence) || confidence < ConfidenceEngine.MIN_CONFIDENCE
                || confidence > ConfidenceEngine.MAX_CONFIDENCE) {
                throw new GraphIntegrityException("Confidence " + confidence + " out of bounds for node " + node.getId());
            }
            if (node.getStatus() == NodeStatus.ACTIVE && ConfidenceEngine.isBelowThreshold(confidence)) {
                throw new GraphIntegrityException("Active node " + node.getId() + " has confidence " + confidence
                    + " below the deprecation threshold");
            }
        }

        Set<EdgeKey> keys = new HashSet<>();
        for (KnowledgeEdge edge : snapshot.getEdges()) {
            if (edge.getRelation() == null) {
                throw new GraphIntegrityException("Edge without relation: " + edge.getSource() + " -> " + edge.getTarget());
            }
            if (!ids.contains(edge.getSource()) || !ids.contains(edge.getTarget())) {
                throw new GraphIntegrityException("Dangling edge " + edge.key());
            }
            if (edge.getSource().equals(edge.getTarget())) {
                throw new GraphIntegrityException("Self-loop edge " + edge.key());
            }
            if (!keys.add(edge.key())) {
                throw new GraphIntegrityException("Duplicate edge " + edge.key());
            }
        }
    }
}
