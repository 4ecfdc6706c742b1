package com.purchasingpower.recall.maintenance.impl;

import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.VectorMatch;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.configuration.MaintenanceProperties;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.MaintenanceCheckpoint;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.exception.PersistenceFailureException;
import com.purchasingpower.recall.knowledge.ConfidenceEngine;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.ImportanceRanker;
import com.purchasingpower.recall.knowledge.ImportanceScores;
import com.purchasingpower.recall.knowledge.LabelNormalizer;
import com.purchasingpower.recall.maintenance.MaintenanceReport;
import com.purchasingpower.recall.maintenance.MaintenanceScheduler;
import com.purchasingpower.recall.maintenance.MaintenanceStage;
import com.purchasingpower.recall.persistence.PendingReflectionMarker;
import com.purchasingpower.recall.persistence.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Checkpointed maintenance pass.
 *
 * <pre>
 *   DECAY        charge decay up to the pass time on every active node
 *   DEDUPLICATE  merge same-type nodes with equal labels or similar vectors
 *   PRUNE        deprecate anything left below the threshold
 *   RERANK       recompute importance over the active subgraph
 * </pre>
 *
 * <p>Duplicate candidates are grouped transitively (union-find) before any
 * merge, and each group merges into its best node, so the result does not
 * depend on the order nodes were inserted or visited. The merges run in one
 * transaction. A whole pass holds the graph store exclusively, so it never
 * interleaves with a reflection cycle or an ingestion.
 *
 * <p>{@link #runAndPersist()} does not save while a reflection marker for an
 * uncommitted cycle is pending: the graph may hold that cycle's changes.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultMaintenanceScheduler implements MaintenanceScheduler {

    private static final String COLLABORATOR = "vector-store";

    /**
     * Best node first: higher confidence, then higher use count, then earlier
     * creation, then smaller id.
     */
    static final Comparator<KnowledgeNode> MERGE_PRIORITY = Comparator
        .comparingDouble(KnowledgeNode::getConfidence).reversed()
        .thenComparing(Comparator.comparingInt(KnowledgeNode::getUseCount).reversed())
        .thenComparing(KnowledgeNode::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(KnowledgeNode::getId);

    private final GraphStore graphStore;
    private final ImportanceRanker importanceRanker;
    private final VectorSimilarityClient vectorClient;
    private final CollaboratorGuard guard;
    private final SnapshotStore snapshotStore;
    private final Clock clock;
    private final MaintenanceProperties properties;
    private final Duration vectorTimeout;

    private final ReentrantLock passLock = new ReentrantLock();
    private final Set<String> indexedNodeIds = ConcurrentHashMap.newKeySet();

    public DefaultMaintenanceScheduler(GraphStore graphStore,
                                       ImportanceRanker importanceRanker,
                                       VectorSimilarityClient vectorClient,
                                       CollaboratorGuard guard,
                                       SnapshotStore snapshotStore,
                                       Clock clock,
                                       AppProperties properties) {
        this.graphStore = graphStore;
        this.importanceRanker = importanceRanker;
        this.vectorClient = vectorClient;
        this.guard = guard;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
        this.properties = properties.getMaintenance();
        this.vectorTimeout = Duration.ofMillis(properties.getVector().getTimeoutMs());
    }

    @Scheduled(fixedDelayString = "${app.maintenance.interval-ms:3600000}",
               initialDelayString = "${app.maintenance.initial-delay-ms:60000}")
    public void scheduledPass() {
        if (!properties.isEnabled()) {
            return;
        }
        if (passLock.isLocked()) {
            log.info("⏭️ Maintenance pass already running, skipping scheduled trigger");
            return;
        }
        try {
            runAndPersist();
        } catch (RuntimeException e) {
            log.error("❌ Scheduled maintenance pass failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public MaintenanceReport runAndPersist() {
        return graphStore.exclusively(() -> {
            MaintenanceReport report = runPass(clock.instant());
            Optional<PendingReflectionMarker> pending = snapshotStore.readMarker()
                .filter(marker -> !marker.getCycleId().equals(graphStore.lastReflectedCycleId().orElse(null)));
            if (pending.isPresent()) {
                log.warn("⚠️ Maintenance pass {} not persisted: reflection {} has not committed",
                    report.getPassId(), pending.get().getCycleId());
                return report;
            }
            try {
                snapshotStore.save(graphStore.snapshot());
            } catch (PersistenceFailureException e) {
                log.error("❌ Maintenance pass {} not persisted: {}", report.getPassId(), e.getMessage());
                throw e;
            }
            report.setPersisted(true);
            return report;
        });
    }

    @Override
    public MaintenanceReport runPass(Instant now) {
        return graphStore.exclusively(() -> {
            passLock.lock();
            try {
                return pass(now);
            } finally {
                passLock.unlock();
            }
        });
    }

    private MaintenanceReport pass(Instant now) {
        long startTime = System.currentTimeMillis();
        MaintenanceCheckpoint checkpoint = graphStore.maintenanceCheckpoint()
            .filter(cp -> !cp.isCompleted())
            .orElse(null);

        MaintenanceReport report;
        MaintenanceStage stage;
        if (checkpoint != null) {
            report = MaintenanceReport.builder()
                .passId(checkpoint.getPassId())
                .passTime(checkpoint.getPassTime())
                .resumed(true)
                .build();
            stage = MaintenanceStage.after(checkpoint.getLastCompletedStage());
            log.info("🔁 Resuming maintenance pass {} at stage {}", checkpoint.getPassId(), stage);
        } else {
            report = MaintenanceReport.builder()
                .passId(UUID.randomUUID().toString())
                .passTime(now)
                .build();
            stage = MaintenanceStage.DECAY;
            checkpoint = MaintenanceCheckpoint.builder()
                .passId(report.getPassId())
                .passTime(now)
                .build();
            graphStore.updateMaintenanceCheckpoint(checkpoint);
            log.info("🔧 Starting maintenance pass {}", report.getPassId());
        }

        while (stage != null) {
            runStage(stage, report);
            checkpoint.setLastCompletedStage(stage.name());
            checkpoint.setCompleted(stage.isFinal());
            graphStore.updateMaintenanceCheckpoint(checkpoint);
            report.getCompletedStages().add(stage);
            stage = MaintenanceStage.after(stage.name());
        }

        report.setDurationMs(System.currentTimeMillis() - startTime);
        log.info("✅ Maintenance pass {} done: decayed={}, merged={}, pruned={}, ranked={}{} ({}ms)",
            report.getPassId(), report.getDecayed(), report.getMerged(), report.getPruned(), report.getRanked(),
            report.isVectorDegraded() ? " [exact-only dedup]" : "", report.getDurationMs());
        return report;
    }

    private void runStage(MaintenanceStage stage, MaintenanceReport report) {
        log.debug("Maintenance {} stage {}", report.getPassId(), stage);
        switch (stage) {
            case DECAY:
                decay(report);
                break;
            case DEDUPLICATE:
                deduplicate(report);
                break;
            case PRUNE:
                prune(report);
                break;
            case RERANK:
                rerank(report);
                break;
            default:
                throw new IllegalStateException("Unknown stage: " + stage);
        }
    }

    // =========================================================================
    // Stages
    // =========================================================================

    private void decay(MaintenanceReport report) {
        for (KnowledgeNode node : graphStore.activeNodes()) {
            double after = graphStore.applyDecay(node.getId(), report.getPassTime());
            if (after != node.getConfidence()) {
                graphStore.markPass(node.getId(), report.getPassId());
                report.setDecayed(report.getDecayed() + 1);
                if (ConfidenceEngine.isBelowThreshold(after)) {
                    report.setPruned(report.getPruned() + 1);
                }
            }
        }
    }

    private void deduplicate(MaintenanceReport report) {
        List<KnowledgeNode> active = graphStore.activeNodes().stream()
            .sorted(Comparator.comparing(KnowledgeNode::getId))
            .collect(Collectors.toList());
        Map<String, KnowledgeNode> byId = new HashMap<>();
        active.forEach(n -> byId.put(n.getId(), n));

        UnionFind groups = new UnionFind();

        Map<String, String> firstByLabel = new HashMap<>();
        for (KnowledgeNode node : active) {
            String key = node.getType().value() + "|" + LabelNormalizer.normalize(node.getLabel());
            String first = firstByLabel.putIfAbsent(key, node.getId());
            if (first != null) {
                groups.union(first, node.getId());
            }
        }

        boolean degraded = !similarPairs(active, byId, groups);
        report.setVectorDegraded(degraded);

        Map<String, List<KnowledgeNode>> components = new TreeMap<>();
        for (KnowledgeNode node : active) {
            components.computeIfAbsent(groups.find(node.getId()), k -> new ArrayList<>()).add(node);
        }

        List<String> dropped = new ArrayList<>();
        graphStore.inTransaction(() -> {
            for (List<KnowledgeNode> members : components.values()) {
                if (members.size() < 2) {
                    continue;
                }
                List<KnowledgeNode> current = members.stream()
                    .map(m -> graphStore.findNode(m.getId()).orElse(null))
                    .filter(m -> m != null && m.isActive())
                    .sorted(MERGE_PRIORITY)
                    .collect(Collectors.toList());
                if (current.size() < 2) {
                    continue;
                }
                KnowledgeNode keep = current.get(0);
                current.stream()
                    .skip(1)
                    .sorted(Comparator.comparing(KnowledgeNode::getId))
                    .forEach(drop -> {
                        graphStore.mergeNodes(keep.getId(), drop.getId(), report.getPassId());
                        dropped.add(drop.getId());
                    });
            }
            return null;
        });

        report.setMerged(dropped.size());
        forgetIndexed(dropped);
    }

    private void prune(MaintenanceReport report) {
        for (KnowledgeNode node : graphStore.activeNodes()) {
            if (ConfidenceEngine.isBelowThreshold(node.getConfidence())) {
                graphStore.deprecate(node.getId(),
                    String.format("confidence below threshold (%.3f)", node.getConfidence()));
                graphStore.markPass(node.getId(), report.getPassId());
                report.setPruned(report.getPruned() + 1);
            }
        }
    }

    private void rerank(MaintenanceReport report) {
        ImportanceScores scores = importanceRanker.rank(graphStore.snapshot());
        report.setRanked(scores.size());
    }

    // =========================================================================
    // Similarity
    // =========================================================================

    /**
     * Union every same-type pair the vector collaborator finds similar enough.
     *
     * @return false if the collaborator failed and dedup fell back to exact labels
     */
    private boolean similarPairs(List<KnowledgeNode> active, Map<String, KnowledgeNode> byId, UnionFind groups) {
        try {
            for (KnowledgeNode node : active) {
                if (indexedNodeIds.add(node.getId())) {
                    try {
                        guard.run(COLLABORATOR, vectorTimeout, () ->
                            vectorClient.index(VectorSimilarityClient.NODES_COLLECTION, node.getId(), node.getLabel()));
                    } catch (CollaboratorTimeoutException e) {
                        indexedNodeIds.remove(node.getId());
                        throw e;
                    }
                }
            }

            for (KnowledgeNode node : active) {
                List<VectorMatch> matches = guard.call(COLLABORATOR, vectorTimeout, () -> vectorClient.similar(
                    VectorSimilarityClient.NODES_COLLECTION,
                    node.getLabel(),
                    properties.getSimilarityTopK(),
                    properties.getSimilarityThreshold()));

                for (VectorMatch match : matches) {
                    KnowledgeNode other = byId.get(match.itemId());
                    if (other != null
                        && !other.getId().equals(node.getId())
                        && other.getType() == node.getType()
                        && match.score() >= properties.getSimilarityThreshold()) {
                        groups.union(node.getId(), other.getId());
                    }
                }
            }
            return true;
        } catch (CollaboratorTimeoutException e) {
            log.warn("⚠️ Vector similarity unavailable, deduplicating exact labels only: {}", e.getMessage());
            return false;
        }
    }

    private void forgetIndexed(List<String> dropped) {
        for (String nodeId : dropped) {
            indexedNodeIds.remove(nodeId);
            try {
                guard.run(COLLABORATOR, vectorTimeout,
                    () -> vectorClient.remove(VectorSimilarityClient.NODES_COLLECTION, nodeId));
            } catch (CollaboratorTimeoutException e) {
                log.warn("⚠️ Merged node {} left in the vector index: {}", nodeId, e.getMessage());
            }
        }
    }

    /**
     * Union-find over node ids. The representative of a set is its smallest id.
     */
    static final class UnionFind {

        private final Map<String, String> parent = new HashMap<>();

        String find(String id) {
            String root = id;
            while (!root.equals(parent.getOrDefault(root, root))) {
                root = parent.get(root);
            }
            String current = id;
            while (!current.equals(root)) {
                String next = parent.getOrDefault(current, root);
                parent.put(current, root);
                current = next;
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                return;
            }
            if (rootA.compareTo(rootB) < 0) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootA, rootB);
            }
        }
    }
}
