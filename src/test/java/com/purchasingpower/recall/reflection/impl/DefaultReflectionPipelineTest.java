package com.purchasingpower.recall.reflection.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.recall.client.LexicalVectorIndex;
import com.purchasingpower.recall.client.VectorMatch;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.exception.PersistenceFailureException;
import com.purchasingpower.recall.knowledge.RelationshipDirection;
import com.purchasingpower.recall.knowledge.impl.DefaultMistakeIndex;
import com.purchasingpower.recall.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.recall.knowledge.impl.PageRankImportanceRanker;
import com.purchasingpower.recall.maintenance.MaintenanceReport;
import com.purchasingpower.recall.maintenance.MaintenanceScheduler;
import com.purchasingpower.recall.maintenance.impl.DefaultMaintenanceScheduler;
import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.model.synthesis.Correction;
import com.purchasingpower.recall.model.synthesis.Insight;
import com.purchasingpower.recall.model.synthesis.Learning;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import com.purchasingpower.recall.persistence.JournalEntry;
import com.purchasingpower.recall.persistence.SessionJournal;
import com.purchasingpower.recall.persistence.SnapshotStore;
import com.purchasingpower.recall.persistence.impl.FileSessionJournal;
import com.purchasingpower.recall.persistence.impl.JsonSnapshotStore;
import com.purchasingpower.recall.reflection.ReflectionOutcome;
import com.purchasingpower.recall.reflection.ReflectionResult;
import com.purchasingpower.recall.reflection.ReflectionState;
import com.purchasingpower.recall.reflection.SessionSynthesizer;
import com.purchasingpower.recall.support.MutableClock;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@DisplayName("Reflection Pipeline Tests")
class DefaultReflectionPipelineTest {

    private static final String SESSION = "session-1";
    private static final String CANBERRA = "Canberra is the capital of Australia";
    private static final String SYDNEY = "Sydney is the capital of Australia";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemoryGraphStore store;
    private LexicalVectorIndex vectorIndex;
    private InMemoryInteractionLog interactionLog;
    private SnapshotStore snapshotStore;
    private FileSessionJournal journal;
    private DefaultMistakeIndex mistakeIndex;
    private final AtomicReference<SynthesisStep> nextSynthesis = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestSupport.T0);
        store = new InMemoryGraphStore(clock);
        vectorIndex = new LexicalVectorIndex();
        interactionLog = new InMemoryInteractionLog(clock);
        snapshotStore = newSnapshotStore();
        journal = new FileSessionJournal(new ObjectMapper(), tempDir.resolve("journal"));
        mistakeIndex = new DefaultMistakeIndex(store, vectorIndex, TestSupport.directGuard(), TestSupport.properties());

        interactionLog.append(Interaction.builder().sessionId(SESSION)
            .userMessage("What is the capital of Australia?").assistantMessage("Sydney").build());
        interactionLog.append(Interaction.builder().sessionId(SESSION)
            .userMessage("Wrong, it is Canberra").assistantMessage("You are right, Canberra.").build());
    }

    @Test
    @DisplayName("Should apply learnings and corrections, journal the session and commit the snapshot")
    void commitsCycle() {
        // Given
        String typed = store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .sessionSummary("Geography and Java")
            .learnings(List.of(learning("Java is statically typed", 0.3), learning(CANBERRA, 0.2)))
            .corrections(List.of(correction()))
            .build());
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore);

        // When
        ReflectionResult result = pipeline.reflect(SESSION);

        // Then
        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.COMMITTED);
        assertThat(result.getInteractions()).isEqualTo(2);
        assertThat(result.getLearningsApplied()).isEqualTo(2);
        assertThat(result.getCorrectionsApplied()).isEqualTo(1);
        assertThat(result.getMaintenance()).isNotNull();
        assertThat(pipeline.state()).isEqualTo(ReflectionState.IDLE);

        assertThat(store.getNode(typed).getConfidence()).isCloseTo(0.7, within(1e-9));
        KnowledgeNode canberra = store.findActiveByLabel(NodeType.FACT, CANBERRA).orElseThrow();
        assertThat(canberra.getConfidence()).isCloseTo(0.7, within(1e-9));
        KnowledgeNode sydney = store.findActiveByLabel(NodeType.FACT, SYDNEY).orElseThrow();
        assertThat(sydney.getConfidence()).isCloseTo(0.1, within(1e-9));
        assertThat(store.neighbors(canberra.getId(), RelationshipDirection.OUTGOING, null))
            .extracting(Neighbor::node)
            .extracting(KnowledgeNode::getId)
            .contains(sydney.getId());

        GraphSnapshot persisted = snapshotStore.load().orElseThrow();
        assertThat(persisted.getLastReflectedCycleId()).isEqualTo(result.getCycleId());
        assertThat(persisted.getNodes()).hasSameSizeAs(store.snapshot().getNodes());
        assertThat(snapshotStore.readMarker()).isEmpty();

        assertThat(journal.read(SESSION)).get().satisfies(entry -> {
            assertThat(entry.getCycleId()).isEqualTo(result.getCycleId());
            assertThat(entry.getCorrections()).containsExactly(SYDNEY + " -> " + CANBERRA);
        });

        assertThat(mistakeIndex.warningsFor("capital of Australia")).singleElement()
            .satisfies(w -> assertThat(w.getCorrectAnswer()).isEqualTo(CANBERRA));
    }

    @Test
    @DisplayName("Insights need two supporters above inferred confidence")
    void insightThreshold() {
        // Given
        String cache = store.upsertNode(NodeType.FACT, "Redis caches sessions", Map.of());
        String memory = store.upsertNode(NodeType.FACT, "Redis keeps data in memory", Map.of());
        String weak = store.upsertNode(NodeType.FACT, "Redis was written in Rust", Map.of(), 0.2);
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.6)
            .insights(List.of(
                Insight.builder().claim("Redis suits hot lookups").supportingNodeIds(List.of(cache, memory)).build(),
                Insight.builder().claim("Redis is a Rust project").supportingNodeIds(List.of(weak, cache)).build()))
            .build());
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore);

        // When
        ReflectionResult result = pipeline.reflect(SESSION);

        // Then
        assertThat(result.getInsightsAdded()).isEqualTo(1);
        assertThat(result.getInsightsDropped()).isEqualTo(1);

        KnowledgeNode insight = store.findActiveByLabel(NodeType.CONCEPT, "Redis suits hot lookups").orElseThrow();
        assertThat(insight.getConfidence()).isCloseTo(0.3, within(1e-9));
        assertThat(insight.getAttributes()).containsEntry("kind", "insight");
        assertThat(store.neighbors(insight.getId(), RelationshipDirection.OUTGOING, null))
            .allSatisfy(n -> assertThat(n.edge().getRelation()).isEqualTo(RelationType.INFERRED_FROM))
            .extracting(n -> n.node().getId())
            .containsExactlyInAnyOrder(cache, memory);
        assertThat(store.findActiveByLabel(NodeType.CONCEPT, "Redis is a Rust project")).isEmpty();
    }

    @Test
    @DisplayName("No interactions means nothing to do")
    void abortsWithoutInteractions() {
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore);

        ReflectionResult result = pipeline.reflect("empty-session");

        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.ABORTED);
        assertThat(result.getReason()).isEqualTo("no interactions");
    }

    @Test
    @DisplayName("Malformed or late synthesis aborts with the graph untouched")
    void abortsOnBadSynthesis() {
        // Given
        store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        GraphSnapshot before = store.snapshot();
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore);

        // When: malformed
        nextSynthesis.set(() -> {
            throw new CollaboratorMalformedException("Invalid session synthesis", List.of("qualityScore: must not be null"));
        });
        ReflectionResult malformed = pipeline.reflect(SESSION);

        // When: timeout
        nextSynthesis.set(() -> {
            throw new CollaboratorTimeoutException("llm", Duration.ofSeconds(120));
        });
        ReflectionResult late = pipeline.reflect(SESSION);

        // Then
        assertThat(malformed.getOutcome()).isEqualTo(ReflectionOutcome.ABORTED);
        assertThat(late.getOutcome()).isEqualTo(ReflectionOutcome.ABORTED);
        assertThat(store.snapshot()).isEqualTo(before);
        assertThat(snapshotStore.load()).isEmpty();
        assertThat(snapshotStore.readMarker()).isEmpty();
        assertThat(journal.read(SESSION)).isEmpty();
    }

    @Test
    @DisplayName("Persistence failure rolls the graph back to its pre-apply state")
    void rollsBackOnPersistenceFailure() {
        // Given
        store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        GraphSnapshot before = store.snapshot();
        SnapshotStore failing = spy(snapshotStore);
        doThrow(new PersistenceFailureException("disk full", tempDir.resolve("graph/snapshot.json"), null))
            .when(failing).save(any(GraphSnapshot.class));
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .learnings(List.of(learning(CANBERRA, 0.2)))
            .corrections(List.of(correction()))
            .build());
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, failing), failing);

        // When
        ReflectionResult result = pipeline.reflect(SESSION);

        // Then
        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.ROLLED_BACK);
        assertThat(store.snapshot()).isEqualTo(before);
        assertThat(failing.readMarker()).isEmpty();
        verify(failing).clearMarker();
    }

    @Test
    @DisplayName("Cancellation after apply rolls back")
    void cancellationRollsBack() {
        // Given
        GraphSnapshot before = store.snapshot();
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .learnings(List.of(learning(CANBERRA, 0.2)))
            .build());
        AtomicReference<DefaultReflectionPipeline> self = new AtomicReference<>();
        MaintenanceScheduler delegate = newScheduler(store, snapshotStore);
        MaintenanceScheduler cancelling = new MaintenanceScheduler() {
            @Override
            public MaintenanceReport runPass(Instant now) {
                self.get().cancel();
                return delegate.runPass(now);
            }

            @Override
            public MaintenanceReport runAndPersist() {
                return delegate.runAndPersist();
            }
        };
        DefaultReflectionPipeline pipeline = newPipeline(store, cancelling, snapshotStore);
        self.set(pipeline);

        // When
        ReflectionResult result = pipeline.reflect(SESSION);

        // Then
        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.ROLLED_BACK);
        assertThat(store.findActiveByLabel(NodeType.FACT, CANBERRA)).isEmpty();
        assertThat(store.snapshot().getNodes()).isEqualTo(before.getNodes());
        assertThat(pipeline.cancel()).isFalse();
    }

    @Test
    @DisplayName("A second cycle while one is running is skipped")
    void skipsWhenBusy() {
        // Given
        AtomicReference<DefaultReflectionPipeline> self = new AtomicReference<>();
        AtomicReference<ReflectionResult> nested = new AtomicReference<>();
        nextSynthesis.set(() -> {
            nested.set(self.get().reflect("session-2"));
            return SessionSynthesis.builder().qualityScore(0.5).build();
        });
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore);
        self.set(pipeline);

        // When
        ReflectionResult outer = pipeline.reflect(SESSION);

        // Then
        assertThat(outer.getOutcome()).isEqualTo(ReflectionOutcome.COMMITTED);
        assertThat(nested.get().getOutcome()).isEqualTo(ReflectionOutcome.SKIPPED);
        assertThat(nested.get().getSessionId()).isEqualTo("session-2");
    }

    @Test
    @DisplayName("Crash between apply and journal leaves no trace after restart, next cycle runs cleanly")
    void recoversFromCrash() {
        // Given: a committed starting point
        store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        snapshotStore.save(store.snapshot());
        GraphSnapshot committed = snapshotStore.load().orElseThrow();

        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .learnings(List.of(learning(CANBERRA, 0.2)))
            .corrections(List.of(correction()))
            .build());
        DefaultReflectionPipeline crashing = newPipeline(store, new CrashingScheduler(), snapshotStore);

        // When: the process dies while maintaining
        assertThatThrownBy(() -> crashing.reflect(SESSION)).isInstanceOf(SimulatedCrash.class);
        assertThat(snapshotStore.readMarker()).isPresent();

        // And restarts with a fresh graph from disk
        clock.advance(Duration.ofMinutes(5));
        InMemoryGraphStore restarted = new InMemoryGraphStore(clock);
        SnapshotStore reopened = newSnapshotStore();
        DefaultReflectionPipeline recovered = newPipeline(restarted, newScheduler(restarted, reopened), reopened);
        recovered.recover();

        // Then: the uncommitted delta is gone
        assertThat(restarted.snapshot()).isEqualTo(committed);
        assertThat(restarted.findActiveByLabel(NodeType.FACT, CANBERRA)).isEmpty();
        assertThat(reopened.readMarker()).isEmpty();

        // When: the next cycle runs
        ReflectionResult result = recovered.reflect(SESSION);

        // Then: applied exactly once
        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.COMMITTED);
        assertThat(restarted.findNodesByType(NodeType.FACT))
            .filteredOn(n -> n.getLabel().equals(CANBERRA))
            .singleElement()
            .satisfies(n -> {
                assertThat(n.getUseCount()).isEqualTo(2);
                assertThat(n.getConfidence()).isCloseTo(0.7, within(1e-9));
            });
        assertThat(restarted.findNodesByType(NodeType.MISTAKE)).hasSize(1);
        assertThat(reopened.load().orElseThrow().getLastReflectedCycleId()).isEqualTo(result.getCycleId());
    }

    @Test
    @DisplayName("Recovery re-indexes mistakes and nodes when the vector index starts empty")
    void recoveryReindexes() {
        // Given: a committed correction cycle
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .corrections(List.of(correction()))
            .build());
        ReflectionResult committed = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore)
            .reflect(SESSION);
        assertThat(committed.getOutcome()).isEqualTo(ReflectionOutcome.COMMITTED);

        // When: the process restarts with an in-memory vector index that lost everything
        InMemoryGraphStore restarted = new InMemoryGraphStore(clock);
        LexicalVectorIndex emptyIndex = new LexicalVectorIndex();
        DefaultMistakeIndex mistakes = new DefaultMistakeIndex(restarted, emptyIndex,
            TestSupport.directGuard(), TestSupport.properties());
        SnapshotStore reopened = newSnapshotStore();
        newPipeline(restarted, newScheduler(restarted, reopened), reopened, journal, mistakes, emptyIndex).recover();

        // Then: mistakes warn again and nodes can seed retrieval
        assertThat(mistakes.warningsFor("capital of Australia")).singleElement()
            .satisfies(w -> assertThat(w.getCorrectAnswer()).isEqualTo(CANBERRA));
        String canberra = restarted.findActiveByLabel(NodeType.FACT, CANBERRA).orElseThrow().getId();
        assertThat(emptyIndex.similar(VectorSimilarityClient.NODES_COLLECTION, CANBERRA, 5, 0.5))
            .extracting(VectorMatch::itemId)
            .contains(canberra);
    }

    @Test
    @DisplayName("A maintenance save during an uncommitted cycle does not persist the cycle's changes")
    void maintenanceSaveSkipsUncommittedCycle() {
        // Given: a committed starting point
        store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        snapshotStore.save(store.snapshot());
        GraphSnapshot committed = snapshotStore.load().orElseThrow();

        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .learnings(List.of(learning(CANBERRA, 0.2)))
            .build());
        DefaultMaintenanceScheduler scheduler = newScheduler(store, snapshotStore);
        AtomicReference<MaintenanceReport> interleaved = new AtomicReference<>();
        SessionJournal crashingJournal = new StubJournal() {
            @Override
            public void write(JournalEntry entry) {
                interleaved.set(scheduler.runAndPersist());
                throw new SimulatedCrash();
            }
        };
        DefaultReflectionPipeline pipeline = newPipeline(store, scheduler, snapshotStore, crashingJournal,
            mistakeIndex, vectorIndex);

        // When: a full maintenance pass runs mid-cycle, then the process dies
        assertThatThrownBy(() -> pipeline.reflect(SESSION)).isInstanceOf(SimulatedCrash.class);

        // Then: nothing of the cycle reached disk
        assertThat(interleaved.get().isPersisted()).isFalse();
        InMemoryGraphStore restarted = new InMemoryGraphStore(clock);
        SnapshotStore reopened = newSnapshotStore();
        newPipeline(restarted, newScheduler(restarted, reopened), reopened).recover();
        assertThat(restarted.snapshot()).isEqualTo(committed);
        assertThat(restarted.findActiveByLabel(NodeType.FACT, CANBERRA)).isEmpty();
        assertThat(restarted.lastReflectedCycleId()).isEmpty();
    }

    @Test
    @DisplayName("A write arriving during a cycle waits and survives the cycle's rollback")
    void concurrentWriteSurvivesRollback() throws InterruptedException {
        // Given
        nextSynthesis.set(() -> SessionSynthesis.builder()
            .qualityScore(0.8)
            .learnings(List.of(learning(CANBERRA, 0.2)))
            .build());
        AtomicBoolean writerWaited = new AtomicBoolean();
        Thread[] writer = new Thread[1];
        SessionJournal failingJournal = new StubJournal() {
            @Override
            public void write(JournalEntry entry) {
                writer[0] = new Thread(() -> store.upsertNode(NodeType.PREFERENCE, "User prefers dark mode", Map.of()));
                writer[0].start();
                try {
                    writer[0].join(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                writerWaited.set(writer[0].isAlive());
                throw new PersistenceFailureException("disk full", tempDir.resolve("journal"), null);
            }
        };
        DefaultReflectionPipeline pipeline = newPipeline(store, newScheduler(store, snapshotStore), snapshotStore,
            failingJournal, mistakeIndex, vectorIndex);

        // When
        ReflectionResult result = pipeline.reflect(SESSION);
        writer[0].join(5_000);

        // Then
        assertThat(result.getOutcome()).isEqualTo(ReflectionOutcome.ROLLED_BACK);
        assertThat(writerWaited).isTrue();
        assertThat(writer[0].isAlive()).isFalse();
        assertThat(store.findActiveByLabel(NodeType.FACT, CANBERRA)).isEmpty();
        assertThat(store.findActiveByLabel(NodeType.PREFERENCE, "User prefers dark mode")).isPresent();
    }

    // =========================================================================
    // Fixtures
    // =========================================================================

    private DefaultReflectionPipeline newPipeline(InMemoryGraphStore graphStore,
                                                  MaintenanceScheduler scheduler,
                                                  SnapshotStore snapshots) {
        DefaultMistakeIndex mistakes = graphStore == store
            ? mistakeIndex
            : new DefaultMistakeIndex(graphStore, vectorIndex, TestSupport.directGuard(), TestSupport.properties());
        return newPipeline(graphStore, scheduler, snapshots, journal, mistakes, vectorIndex);
    }

    private DefaultReflectionPipeline newPipeline(InMemoryGraphStore graphStore,
                                                  MaintenanceScheduler scheduler,
                                                  SnapshotStore snapshots,
                                                  SessionJournal sessionJournal,
                                                  DefaultMistakeIndex mistakes,
                                                  LexicalVectorIndex vectors) {
        SessionSynthesizer synthesizer = (sessionId, interactions) -> nextSynthesis.get().next();
        return new DefaultReflectionPipeline(graphStore, interactionLog, synthesizer, mistakes, scheduler,
            snapshots, sessionJournal, vectors, TestSupport.directGuard(), clock, TestSupport.properties());
    }

    private DefaultMaintenanceScheduler newScheduler(InMemoryGraphStore graphStore, SnapshotStore snapshots) {
        return new DefaultMaintenanceScheduler(graphStore, new PageRankImportanceRanker(TestSupport.properties()),
            vectorIndex, TestSupport.directGuard(), snapshots, clock, TestSupport.properties());
    }

    private JsonSnapshotStore newSnapshotStore() {
        return new JsonSnapshotStore(new ObjectMapper(),
            tempDir.resolve("graph/snapshot.json"), tempDir.resolve("graph/pending.json"));
    }

    private static Learning learning(String claim, double delta) {
        return Learning.builder().claim(claim).confidenceDelta(delta).evidence("user said so").build();
    }

    private static Correction correction() {
        return Correction.builder()
            .wrongClaim(SYDNEY)
            .correctClaim(CANBERRA)
            .question("What is the capital of Australia?")
            .build();
    }

    @FunctionalInterface
    private interface SynthesisStep {
        SessionSynthesis next();
    }

    private static final class SimulatedCrash extends Error {
        SimulatedCrash() {
            super("process terminated");
        }
    }

    private abstract static class StubJournal implements SessionJournal {

        @Override
        public Optional<JournalEntry> read(String sessionId) {
            return Optional.empty();
        }

        @Override
        public List<JournalEntry> history(String sessionId) {
            return List.of();
        }
    }

    private static final class CrashingScheduler implements MaintenanceScheduler {

        @Override
        public MaintenanceReport runPass(Instant now) {
            throw new SimulatedCrash();
        }

        @Override
        public MaintenanceReport runAndPersist() {
            throw new SimulatedCrash();
        }
    }
}
