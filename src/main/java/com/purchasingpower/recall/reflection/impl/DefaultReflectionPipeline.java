package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.core.ConfidenceOperator;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.exception.PersistenceFailureException;
import com.purchasingpower.recall.knowledge.ConfidenceEngine;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.MistakeIndex;
import com.purchasingpower.recall.maintenance.MaintenanceReport;
import com.purchasingpower.recall.maintenance.MaintenanceScheduler;
import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.model.mistake.MistakeRecord;
import com.purchasingpower.recall.model.synthesis.Correction;
import com.purchasingpower.recall.model.synthesis.Insight;
import com.purchasingpower.recall.model.synthesis.Learning;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import com.purchasingpower.recall.persistence.JournalEntry;
import com.purchasingpower.recall.persistence.PendingReflectionMarker;
import com.purchasingpower.recall.persistence.SessionJournal;
import com.purchasingpower.recall.persistence.SnapshotStore;
import com.purchasingpower.recall.reflection.InteractionLog;
import com.purchasingpower.recall.reflection.ReflectionOutcome;
import com.purchasingpower.recall.reflection.ReflectionPipeline;
import com.purchasingpower.recall.reflection.ReflectionResult;
import com.purchasingpower.recall.reflection.ReflectionState;
import com.purchasingpower.recall.reflection.SessionSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reflection pipeline with a pending marker for crash safety.
 *
 * <pre>
 * IDLE -> COLLECTING -> SYNTHESIZING -> APPLYING -> MAINTAINING -> JOURNALING -> IDLE
 *                    \-> (no interactions / timeout / malformed) -> IDLE, nothing applied
 * </pre>
 *
 * <p>The marker is written before APPLYING and removed after the snapshot save
 * in JOURNALING. APPLYING through JOURNALING run while holding the graph store
 * exclusively. Any runtime failure or cancellation after APPLYING began
 * restores the graph to its pre-apply snapshot before the store is released.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultReflectionPipeline implements ReflectionPipeline {

    static final String ATTR_KIND = "kind";
    static final String KIND_INSIGHT = "insight";

    private static final double EDGE_REINFORCEMENT = 0.1;

    private final GraphStore graphStore;
    private final InteractionLog interactionLog;
    private final SessionSynthesizer synthesizer;
    private final MistakeIndex mistakeIndex;
    private final MaintenanceScheduler maintenanceScheduler;
    private final SnapshotStore snapshotStore;
    private final SessionJournal sessionJournal;
    private final VectorSimilarityClient vectorClient;
    private final CollaboratorGuard guard;
    private final Clock clock;
    private final int interactionLimit;
    private final Duration vectorTimeout;

    private final AtomicReference<ReflectionState> state = new AtomicReference<>(ReflectionState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public DefaultReflectionPipeline(GraphStore graphStore,
                                     InteractionLog interactionLog,
                                     SessionSynthesizer synthesizer,
                                     MistakeIndex mistakeIndex,
                                     MaintenanceScheduler maintenanceScheduler,
                                     SnapshotStore snapshotStore,
                                     SessionJournal sessionJournal,
                                     VectorSimilarityClient vectorClient,
                                     CollaboratorGuard guard,
                                     Clock clock,
                                     AppProperties properties) {
        this.graphStore = graphStore;
        this.interactionLog = interactionLog;
        this.synthesizer = synthesizer;
        this.mistakeIndex = mistakeIndex;
        this.maintenanceScheduler = maintenanceScheduler;
        this.snapshotStore = snapshotStore;
        this.sessionJournal = sessionJournal;
        this.vectorClient = vectorClient;
        this.guard = guard;
        this.clock = clock;
        this.interactionLimit = properties.getReflection().getInteractionLimit();
        this.vectorTimeout = Duration.ofMillis(properties.getVector().getTimeoutMs());
    }

    @Override
    public ReflectionState state() {
        return state.get();
    }

    @Override
    public boolean cancel() {
        if (state.get() == ReflectionState.IDLE) {
            return false;
        }
        cancelRequested.set(true);
        log.info("🛑 Cancellation requested for running reflection cycle ({})", state.get());
        return true;
    }

    @Override
    public ReflectionResult reflect(String sessionId) {
        if (!state.compareAndSet(ReflectionState.IDLE, ReflectionState.COLLECTING)) {
            log.info("⏭️ Reflection for session {} skipped, cycle busy in {}", sessionId, state.get());
            return ReflectionResult.skipped(sessionId, state.get());
        }
        cancelRequested.set(false);

        String cycleId = UUID.randomUUID().toString();
        ReflectionResult.ReflectionResultBuilder result = ReflectionResult.builder()
            .cycleId(cycleId)
            .sessionId(sessionId);

        try {
            // COLLECTING
            List<Interaction> interactions = interactionLog.recent(sessionId, interactionLimit);
            result.interactions(interactions.size());
            if (interactions.isEmpty()) {
                log.info("Reflection for session {} aborted: no interactions", sessionId);
                return result.outcome(ReflectionOutcome.ABORTED).reason("no interactions").build();
            }
            checkCancelled();

            // SYNTHESIZING
            transition(ReflectionState.SYNTHESIZING, cycleId);
            SessionSynthesis synthesis;
            try {
                synthesis = synthesizer.synthesize(sessionId, interactions);
            } catch (CollaboratorTimeoutException | CollaboratorMalformedException e) {
                log.warn("⚠️ Reflection for session {} aborted, nothing applied: {}", sessionId, e.getMessage());
                return result.outcome(ReflectionOutcome.ABORTED).reason(e.getMessage()).build();
            }
            result.qualityScore(synthesis.getQualityScore());
            checkCancelled();

            // APPLYING .. JOURNALING hold the store, so other writers wait
            // instead of landing inside the cycle and being undone by a rollback
            Applied applied = new Applied();
            ReflectionResult outcome = graphStore.exclusively(
                () -> commit(cycleId, sessionId, interactions.size(), synthesis, applied, result));
            if (outcome.isCommitted()) {
                indexCommitted(applied);
            }
            return outcome;

        } catch (CancellationException e) {
            log.warn("⚠️ Reflection {} for session {} cancelled", cycleId, sessionId);
            return rollback(result, null, e);
        } catch (RuntimeException e) {
            log.error("❌ Reflection {} for session {} failed: {}", cycleId, sessionId, e.getMessage(), e);
            return rollback(result, null, e);
        } finally {
            state.set(ReflectionState.IDLE);
            cancelRequested.set(false);
        }
    }

    private ReflectionResult commit(String cycleId,
                                    String sessionId,
                                    int interactions,
                                    SessionSynthesis synthesis,
                                    Applied applied,
                                    ReflectionResult.ReflectionResultBuilder result) {
        GraphSnapshot preApply = null;
        try {
            // APPLYING
            transition(ReflectionState.APPLYING, cycleId);
            snapshotStore.writeMarker(PendingReflectionMarker.builder()
                .cycleId(cycleId)
                .sessionId(sessionId)
                .startedAt(clock.instant())
                .build());
            preApply = graphStore.snapshot();

            graphStore.inTransaction(() -> apply(synthesis, sessionId, applied));
            result.learningsApplied(applied.learnings)
                .correctionsApplied(applied.corrections)
                .insightsAdded(applied.insightsAdded)
                .insightsDropped(applied.insightsDropped);
            checkCancelled();

            // MAINTAINING
            transition(ReflectionState.MAINTAINING, cycleId);
            MaintenanceReport maintenance = maintenanceScheduler.runPass(clock.instant());
            result.maintenance(maintenance);
            checkCancelled();

            // JOURNALING
            transition(ReflectionState.JOURNALING, cycleId);
            sessionJournal.write(journalEntry(cycleId, sessionId, interactions, synthesis, applied, maintenance));
            graphStore.markReflected(cycleId);
            snapshotStore.save(graphStore.snapshot());
            preApply = null;

            clearMarkerQuietly();

            log.info("✅ Reflection {} committed for session {}: {} learnings, {} corrections, {} insights ({} dropped)",
                cycleId, sessionId, applied.learnings, applied.corrections, applied.insightsAdded, applied.insightsDropped);
            return result.outcome(ReflectionOutcome.COMMITTED).build();

        } catch (PersistenceFailureException e) {
            log.error("❌ Reflection {} for session {} failed to persist: {}", cycleId, sessionId, e.getMessage());
            return rollback(result, preApply, e);
        } catch (CancellationException e) {
            log.warn("⚠️ Reflection {} for session {} cancelled", cycleId, sessionId);
            return rollback(result, preApply, e);
        } catch (RuntimeException e) {
            log.error("❌ Reflection {} for session {} failed: {}", cycleId, sessionId, e.getMessage(), e);
            return rollback(result, preApply, e);
        }
    }

    @Override
    public void recover() {
        Optional<GraphSnapshot> persisted = snapshotStore.load();
        persisted.ifPresent(graphStore::restore);

        Optional<PendingReflectionMarker> marker = snapshotStore.readMarker();
        if (marker.isPresent()) {
            String committedCycle = persisted.map(GraphSnapshot::getLastReflectedCycleId).orElse(null);
            if (marker.get().getCycleId().equals(committedCycle)) {
                log.info("🔁 Reflection {} had committed before shutdown, clearing marker", marker.get().getCycleId());
            } else {
                log.warn("🔁 Reflection {} for session {} was interrupted, its changes were discarded",
                    marker.get().getCycleId(), marker.get().getSessionId());
            }
            snapshotStore.clearMarker();
        }

        // the vector collaborator may have started empty
        mistakeIndex.rebuild();
        reindexActiveNodes();
    }

    // =========================================================================
    // Applying
    // =========================================================================

    private Applied apply(SessionSynthesis synthesis, String sessionId, Applied applied) {
        for (Learning learning : synthesis.getLearnings()) {
            applyLearning(learning, sessionId, applied);
        }
        for (Correction correction : synthesis.getCorrections()) {
            applyCorrection(correction, sessionId, applied);
        }
        for (Insight insight : synthesis.getInsights()) {
            applyInsight(insight, sessionId, applied);
        }
        return applied;
    }

    private void applyLearning(Learning learning, String sessionId, Applied applied) {
        double delta = learning.getConfidenceDelta();
        Optional<KnowledgeNode> existing = graphStore.findActiveByLabel(learning.getClaim());

        if (existing.isPresent()) {
            ConfidenceOperator operator = delta > 0.0
                ? ConfidenceOperator.confirmation()
                : delta < 0.0 ? ConfidenceOperator.correction() : ConfidenceOperator.reinforcement();
            graphStore.applyConfidenceOp(existing.get().getId(), operator);
            applied.learnings++;
            applied.learningClaims.add(learning.getClaim());
            return;
        }

        double initial = ConfidenceEngine.clamp(ConfidenceEngine.INITIAL_CONFIDENCE + delta);
        if (ConfidenceEngine.isBelowThreshold(initial)) {
            log.debug("Learning '{}' not stored: initial confidence {} below threshold", learning.getClaim(), initial);
            return;
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("sessionId", sessionId);
        attributes.put("origin", "reflection");
        if (learning.getEvidence() != null) {
            attributes.put("evidence", learning.getEvidence());
        }
        applied.createdNodeIds.add(graphStore.upsertNode(NodeType.FACT, learning.getClaim(), attributes, initial));
        applied.learnings++;
        applied.learningClaims.add(learning.getClaim());
    }

    private void applyCorrection(Correction correction, String sessionId, Applied applied) {
        boolean targetExisted = correction.getRelatedNodeId() != null
            && graphStore.findNode(correction.getRelatedNodeId()).isPresent()
            || graphStore.findActiveByLabel(correction.getWrongClaim()).isPresent();
        String targetId = mistakeIndex.resolveTarget(correction.getRelatedNodeId(), correction.getWrongClaim());
        if (!targetExisted) {
            applied.createdNodeIds.add(targetId);
        }

        KnowledgeNode target = graphStore.getNode(targetId);
        if (target.isActive()) {
            graphStore.applyConfidenceOp(targetId, ConfidenceOperator.correction());
        } else {
            log.debug("Correction target '{}' already deprecated, not penalized again", target.getLabel());
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("sessionId", sessionId);
        attributes.put("origin", "correction");
        boolean correctExisted = graphStore.findActiveByLabel(NodeType.FACT, correction.getCorrectClaim()).isPresent();
        String correctId = graphStore.upsertNode(NodeType.FACT, correction.getCorrectClaim(), attributes);
        if (!correctExisted) {
            applied.createdNodeIds.add(correctId);
        }
        if (!correctId.equals(targetId)) {
            graphStore.addEdge(correctId, targetId, RelationType.CORRECTS, EDGE_REINFORCEMENT, Map.of("sessionId", sessionId));
        }

        String mistakeId = mistakeIndex.record(MistakeRecord.builder()
            .question(correction.getQuestion())
            .wrongAnswer(correction.getWrongClaim())
            .correctAnswer(correction.getCorrectClaim())
            .sessionId(sessionId)
            .relatedNodeId(targetId)
            .build());
        applied.mistakeIds.add(mistakeId);
        applied.corrections++;
        applied.correctionLines.add(correction.getWrongClaim() + " -> " + correction.getCorrectClaim());
    }

    private void applyInsight(Insight insight, String sessionId, Applied applied) {
        List<String> supporters = new ArrayList<>();
        for (String nodeId : new LinkedHashSet<>(insight.getSupportingNodeIds())) {
            graphStore.findNode(nodeId)
                .filter(KnowledgeNode::isActive)
                .filter(n -> n.getConfidence() > ConfidenceEngine.INFERRED_CONFIDENCE)
                .ifPresent(n -> supporters.add(n.getId()));
        }

        if (supporters.size() < 2) {
            log.debug("Insight '{}' dropped: {} qualifying supporters", insight.getClaim(), supporters.size());
            applied.insightsDropped++;
            return;
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_KIND, KIND_INSIGHT);
        attributes.put("sessionId", sessionId);
        boolean existed = graphStore.findActiveByLabel(NodeType.CONCEPT, insight.getClaim()).isPresent();
        String insightId = graphStore.upsertNode(NodeType.CONCEPT, insight.getClaim(), attributes,
            ConfidenceEngine.INFERRED_CONFIDENCE);
        if (!existed) {
            applied.createdNodeIds.add(insightId);
        }

        for (String supporterId : supporters) {
            if (!supporterId.equals(insightId)) {
                graphStore.addEdge(insightId, supporterId, RelationType.INFERRED_FROM, EDGE_REINFORCEMENT);
            }
        }
        applied.insightsAdded++;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void transition(ReflectionState next, String cycleId) {
        ReflectionState previous = state.getAndSet(next);
        log.info("🔄 Reflection {}: {} -> {}", cycleId, previous, next);
    }

    private void checkCancelled() {
        if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Reflection cycle cancelled");
        }
    }

    private ReflectionResult rollback(ReflectionResult.ReflectionResultBuilder result,
                                      GraphSnapshot preApply,
                                      RuntimeException cause) {
        if (preApply == null) {
            return result.outcome(ReflectionOutcome.ABORTED).reason(cause.getMessage()).build();
        }

        graphStore.restore(preApply);
        log.warn("↩️ Graph rolled back to its pre-reflection state");
        clearMarkerQuietly();
        return result.outcome(ReflectionOutcome.ROLLED_BACK).reason(cause.getMessage()).build();
    }

    private void clearMarkerQuietly() {
        try {
            snapshotStore.clearMarker();
        } catch (PersistenceFailureException e) {
            // A stale marker is settled by recover() on the next start
            log.warn("⚠️ Pending marker not cleared: {}", e.getMessage());
        }
    }

    private void indexCommitted(Applied applied) {
        for (String mistakeId : applied.mistakeIds) {
            mistakeIndex.indexMistake(mistakeId);
        }
        indexNodes(applied.createdNodeIds);
    }

    private void reindexActiveNodes() {
        List<String> nodeIds = new ArrayList<>();
        for (KnowledgeNode node : graphStore.activeNodes()) {
            if (node.getType() != NodeType.MISTAKE) {
                nodeIds.add(node.getId());
            }
        }
        int indexed = indexNodes(nodeIds);
        log.info("📚 Node index rebuilt: {} of {} active nodes", indexed, nodeIds.size());
    }

    /**
     * @return how many nodes were indexed before the collaborator failed, if it did
     */
    private int indexNodes(Iterable<String> nodeIds) {
        int indexed = 0;
        for (String nodeId : nodeIds) {
            Optional<KnowledgeNode> node = graphStore.findNode(nodeId).filter(KnowledgeNode::isActive);
            if (node.isEmpty()) {
                continue;
            }
            try {
                guard.run("vector-store", vectorTimeout,
                    () -> vectorClient.index(VectorSimilarityClient.NODES_COLLECTION, nodeId, node.get().getLabel()));
                indexed++;
            } catch (CollaboratorTimeoutException e) {
                log.warn("⚠️ Node indexing stopped after failure: {}", e.getMessage());
                return indexed;
            }
        }
        return indexed;
    }

    private JournalEntry journalEntry(String cycleId, String sessionId, int interactions,
                                      SessionSynthesis synthesis, Applied applied, MaintenanceReport maintenance) {
        return JournalEntry.builder()
            .sessionId(sessionId)
            .cycleId(cycleId)
            .reflectedAt(clock.instant())
            .qualityScore(synthesis.getQualityScore())
            .sessionSummary(synthesis.getSessionSummary())
            .interactions(interactions)
            .learningsApplied(applied.learnings)
            .correctionsApplied(applied.corrections)
            .insightsAdded(applied.insightsAdded)
            .insightsDropped(applied.insightsDropped)
            .learnings(new ArrayList<>(applied.learningClaims))
            .corrections(new ArrayList<>(applied.correctionLines))
            .patterns(new ArrayList<>(synthesis.getPatterns()))
            .knowledgeGaps(new ArrayList<>(synthesis.getKnowledgeGaps()))
            .maintenancePassId(maintenance != null ? maintenance.getPassId() : null)
            .build();
    }

    /**
     * Tally of one APPLYING stage.
     */
    private static final class Applied {
        private int learnings;
        private int corrections;
        private int insightsAdded;
        private int insightsDropped;
        private final List<String> learningClaims = new ArrayList<>();
        private final List<String> correctionLines = new ArrayList<>();
        private final Set<String> createdNodeIds = new LinkedHashSet<>();
        private final List<String> mistakeIds = new ArrayList<>();
    }
}
