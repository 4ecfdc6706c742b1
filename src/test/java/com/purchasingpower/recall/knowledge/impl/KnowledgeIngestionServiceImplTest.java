package com.purchasingpower.recall.knowledge.impl;

import com.purchasingpower.recall.client.LexicalVectorIndex;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.core.KnowledgeEdge;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.model.extraction.CandidateEdge;
import com.purchasingpower.recall.model.extraction.CandidateNode;
import com.purchasingpower.recall.model.extraction.ExtractionBatch;
import com.purchasingpower.recall.model.extraction.IngestionResult;
import com.purchasingpower.recall.support.FailingVectorClient;
import com.purchasingpower.recall.support.MutableClock;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Knowledge Ingestion Tests")
class KnowledgeIngestionServiceImplTest {

    private InMemoryGraphStore store;
    private LexicalVectorIndex vectorIndex;
    private KnowledgeIngestionServiceImpl ingestion;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(new MutableClock(TestSupport.T0));
        vectorIndex = new LexicalVectorIndex();
        ingestion = new KnowledgeIngestionServiceImpl(store, vectorIndex, TestSupport.directGuard(),
            TestSupport.validator(), TestSupport.properties());
    }

    @Test
    @DisplayName("Should create nodes and edges with provenance and index new nodes")
    void ingestsBatch() {
        // Given
        ExtractionBatch batch = batch("i-1",
            List.of(node(NodeType.TECHNOLOGY, "Spring Boot", null), node(NodeType.TECHNOLOGY, "Java", 0.8)),
            List.of(edge("spring boot", "JAVA", RelationType.DEPENDS_ON)));

        // When
        IngestionResult result = ingestion.ingest(batch);

        // Then
        assertThat(result.getNodesCreated()).isEqualTo(2);
        assertThat(result.getEdgesCreated()).isEqualTo(1);
        assertThat(result.hasNewKnowledge()).isTrue();

        KnowledgeNode java = store.getNode(result.getNodeIds().get(1));
        assertThat(java.getConfidence()).isEqualTo(0.8);
        assertThat(java.getAttributes())
            .containsEntry("sourceInteractionId", "i-1")
            .containsEntry("sessionId", "session-1");

        assertThat(vectorIndex.similar(VectorSimilarityClient.NODES_COLLECTION, "spring boot", 5, 0.5))
            .extracting(m -> m.itemId())
            .contains(result.getNodeIds().get(0));
    }

    @Test
    @DisplayName("Re-ingesting resolves existing nodes and strengthens edges")
    void reingestResolves() {
        ExtractionBatch batch = batch("i-1",
            List.of(node(NodeType.TECHNOLOGY, "Spring Boot", null), node(NodeType.TECHNOLOGY, "Java", null)),
            List.of(edge("Spring Boot", "Java", RelationType.DEPENDS_ON)));
        IngestionResult first = ingestion.ingest(batch);

        IngestionResult second = ingestion.ingest(batch);

        assertThat(second.getNodesCreated()).isZero();
        assertThat(second.getNodesResolved()).isEqualTo(2);
        assertThat(second.getEdgesReinforced()).isEqualTo(1);
        assertThat(second.getNodeIds()).isEqualTo(first.getNodeIds());
        assertThat(second.hasNewKnowledge()).isFalse();
        assertThat(store.edges()).singleElement()
            .satisfies(e -> assertThat(e.getWeight()).isGreaterThan(1.0));
    }

    @Test
    @DisplayName("Edges resolve against existing graph nodes outside the batch")
    void resolvesAgainstGraph() {
        String existing = store.upsertNode(NodeType.PERSON, "Alice", null);

        IngestionResult result = ingestion.ingest(batch("i-2",
            List.of(node(NodeType.SKILL, "Kotlin", null)),
            List.of(edge("alice", "Kotlin", RelationType.KNOWS), edge("Kotlin", "Nobody", RelationType.RELATES_TO))));

        assertThat(result.getEdgesCreated()).isEqualTo(1);
        assertThat(result.getEdgesSkipped()).isEqualTo(1);
        assertThat(store.edges()).singleElement()
            .satisfies(e -> assertThat(e.getSource()).isEqualTo(existing));
    }

    @Test
    @DisplayName("New candidates below the deprecation threshold are dropped")
    void dropsWeakCandidates() {
        IngestionResult result = ingestion.ingest(batch("i-3",
            List.of(node(NodeType.FACT, "Maybe true", 0.01)), List.of()));

        assertThat(result.getNodesCreated()).isZero();
        assertThat(store.activeNodes()).isEmpty();
    }

    @Test
    @DisplayName("Malformed batches are rejected without touching the graph")
    void rejectsMalformedBatch() {
        ExtractionBatch bad = batch("i-4",
            List.of(node(NodeType.FACT, "Fine", null), node(null, " ", 1.5)), List.of());

        assertThatThrownBy(() -> ingestion.ingest(bad))
            .isInstanceOf(CollaboratorMalformedException.class)
            .satisfies(e -> assertThat(((CollaboratorMalformedException) e).getViolations()).hasSize(3));
        assertThat(store.activeNodes()).isEmpty();
    }

    @Test
    @DisplayName("Should infer relates_to edges one hop out from the batch's nodes")
    void infersTransitiveRelations() {
        // Given: kafka -relates_to-> streaming -relates_to-> flink, and a retired spark
        String kafka = store.upsertNode(NodeType.TECHNOLOGY, "Kafka", Map.of());
        String streaming = store.upsertNode(NodeType.CONCEPT, "Stream processing", Map.of());
        String flink = store.upsertNode(NodeType.TECHNOLOGY, "Flink", Map.of());
        String spark = store.upsertNode(NodeType.TECHNOLOGY, "Spark Streaming", Map.of());
        store.addEdge(kafka, streaming, RelationType.RELATES_TO, 0.1);
        store.addEdge(streaming, flink, RelationType.RELATES_TO, 0.1);
        store.addEdge(streaming, spark, RelationType.RELATES_TO, 0.1);
        store.deprecate(spark, "outdated");

        // When
        IngestionResult result = ingestion.ingest(batch("i-6",
            List.of(node(NodeType.ENTITY, "Order service", null), node(NodeType.TECHNOLOGY, "Kafka", null)),
            List.of(edge("Order service", "Kafka", RelationType.DEPENDS_ON))));

        // Then
        String orders = result.getNodeIds().get(0);
        assertThat(result.getEdgesCreated()).isEqualTo(1);
        assertThat(result.getEdgesInferred()).isEqualTo(2);
        assertThat(store.edges())
            .filteredOn(e -> "true".equals(e.getAttributes().get("inferred")))
            .allSatisfy(e -> {
                assertThat(e.getRelation()).isEqualTo(RelationType.RELATES_TO);
                assertThat(e.getWeight()).isEqualTo(KnowledgeEdge.DEFAULT_WEIGHT);
                assertThat(e.getAttributes()).containsEntry("confidence", "0.3");
            })
            .extracting(e -> e.getSource() + "->" + e.getTarget())
            .containsExactlyInAnyOrder(orders + "->" + streaming, kafka + "->" + flink);
    }

    @Test
    @DisplayName("Existing links and the node itself are never inferred")
    void skipsExistingLinks() {
        // Given: a -relates_to-> b -relates_to-> a, and b -relates_to-> c that a already reaches
        String a = store.upsertNode(NodeType.CONCEPT, "Caching", Map.of());
        String b = store.upsertNode(NodeType.CONCEPT, "Latency", Map.of());
        String c = store.upsertNode(NodeType.CONCEPT, "Throughput", Map.of());
        store.addEdge(a, b, RelationType.RELATES_TO, 0.1);
        store.addEdge(b, a, RelationType.RELATES_TO, 0.1);
        store.addEdge(b, c, RelationType.RELATES_TO, 0.1);
        store.addEdge(a, c, RelationType.DEPENDS_ON, 0.1);

        // When
        IngestionResult result = ingestion.ingest(batch("i-7", List.of(node(NodeType.CONCEPT, "Caching", null)), List.of()));

        // Then
        assertThat(result.getEdgesInferred()).isZero();
        assertThat(store.edges()).hasSize(4);
    }

    @Test
    @DisplayName("Vector outage does not fail ingestion")
    void vectorOutage() {
        KnowledgeIngestionServiceImpl degraded = new KnowledgeIngestionServiceImpl(store, new FailingVectorClient(),
            TestSupport.directGuard(), TestSupport.validator(), TestSupport.properties());

        IngestionResult result = degraded.ingest(batch("i-5", List.of(node(NodeType.FACT, "Sky is blue", null)), List.of()));

        assertThat(result.getNodesCreated()).isEqualTo(1);
    }

    private static ExtractionBatch batch(String interactionId, List<CandidateNode> nodes, List<CandidateEdge> edges) {
        return ExtractionBatch.builder()
            .sourceInteractionId(interactionId)
            .sessionId("session-1")
            .nodes(new ArrayList<>(nodes))
            .edges(new ArrayList<>(edges))
            .build();
    }

    private static CandidateNode node(NodeType type, String label, Double hint) {
        return CandidateNode.builder().type(type).label(label).confidenceHint(hint).build();
    }

    private static CandidateEdge edge(String source, String target, RelationType relation) {
        return CandidateEdge.builder().sourceLabel(source).targetLabel(target).relation(relation).build();
    }
}
