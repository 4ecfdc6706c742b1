package com.purchasingpower.recall.knowledge.impl;

import com.purchasingpower.recall.client.LexicalVectorIndex;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.model.mistake.MistakeRecord;
import com.purchasingpower.recall.model.retrieval.RankedNode;
import com.purchasingpower.recall.model.retrieval.RetrievalResult;
import com.purchasingpower.recall.support.FailingVectorClient;
import com.purchasingpower.recall.support.MutableClock;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Retrieval Service Tests")
class RetrievalServiceImplTest {

    private MutableClock clock;
    private InMemoryGraphStore store;
    private LexicalVectorIndex vectorIndex;
    private DefaultMistakeIndex mistakeIndex;
    private RetrievalServiceImpl retrieval;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestSupport.T0);
        store = new InMemoryGraphStore(clock);
        vectorIndex = new LexicalVectorIndex();
        mistakeIndex = new DefaultMistakeIndex(store, vectorIndex, TestSupport.directGuard(), TestSupport.properties());
        retrieval = new RetrievalServiceImpl(store, new PageRankImportanceRanker(TestSupport.properties()),
            mistakeIndex, vectorIndex, TestSupport.directGuard(), clock, TestSupport.properties());
    }

    @Test
    @DisplayName("Should return matching nodes and their neighbors, best first")
    void ranksSeedsAndNeighbors() {
        // Given
        String postgres = store.upsertNode(NodeType.TECHNOLOGY, "PostgreSQL", Map.of(), 0.9);
        String billing = store.upsertNode(NodeType.ENTITY, "Billing service", Map.of(), 0.4);
        store.upsertNode(NodeType.TECHNOLOGY, "Kafka", Map.of(), 0.9);
        store.addEdge(billing, postgres, RelationType.DEPENDS_ON, 0.1);

        // When
        RetrievalResult result = retrieval.retrieve("which database backs postgresql", 10);

        // Then
        assertThat(result.getNodes()).extracting(RankedNode::getNodeId).containsExactly(postgres, billing);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Score combines confidence, importance and recency")
    void scoreFormula() {
        // Given: a single node, so its importance is 1.0
        String id = store.upsertNode(NodeType.TECHNOLOGY, "PostgreSQL", Map.of(), 0.9);
        clock.advanceDays(30);

        // When
        RankedNode ranked = retrieval.retrieve("postgresql", 5).getNodes().get(0);

        // Then
        assertThat(ranked.getNodeId()).isEqualTo(id);
        assertThat(ranked.getConfidence()).isCloseTo(0.87, within(1e-9));
        assertThat(ranked.getScore()).isCloseTo(0.5 * 0.87 + 0.3 * 1.0 + 0.2 * 0.5, within(1e-9));
        assertThat(store.getNode(id).getConfidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Vector seeds find nodes whose labels are not contained in the query")
    void vectorSeeds() {
        String id = store.upsertNode(NodeType.CONCEPT, "Database connection pooling", Map.of());
        vectorIndex.index(VectorSimilarityClient.NODES_COLLECTION, id, "Database connection pooling");

        RetrievalResult result = retrieval.retrieve("tuning connection pooling", 5);

        assertThat(result.getNodes()).extracting(RankedNode::getNodeId).containsExactly(id);
    }

    @Test
    @DisplayName("Deprecated nodes never appear")
    void skipsDeprecated() {
        String id = store.upsertNode(NodeType.TECHNOLOGY, "PostgreSQL", Map.of());
        store.deprecate(id, "manual");

        assertThat(retrieval.retrieve("postgresql", 5).getNodes()).isEmpty();
    }

    @Test
    @DisplayName("Should attach warnings for similar past mistakes")
    void attachesWarnings() {
        String mistakeId = mistakeIndex.record(MistakeRecord.builder()
            .question("What is the capital of Australia?")
            .wrongAnswer("Sydney")
            .correctAnswer("Canberra")
            .build());
        mistakeIndex.indexMistake(mistakeId);

        RetrievalResult result = retrieval.retrieve("capital of Australia", 5);

        assertThat(result.getWarnings()).extracting(w -> w.getCorrectAnswer()).containsExactly("Canberra");
    }

    @Test
    @DisplayName("Vector outage falls back to label matches")
    void vectorOutage() {
        RetrievalServiceImpl degraded = new RetrievalServiceImpl(store, new PageRankImportanceRanker(TestSupport.properties()),
            mistakeIndex, new FailingVectorClient(), TestSupport.directGuard(), clock, TestSupport.properties());
        String id = store.upsertNode(NodeType.TECHNOLOGY, "PostgreSQL", Map.of());

        assertThat(degraded.retrieve("postgresql", 5).getNodes()).extracting(RankedNode::getNodeId).containsExactly(id);
    }

    @Test
    @DisplayName("Blank queries and non-positive limits return nothing")
    void blankQuery() {
        store.upsertNode(NodeType.TECHNOLOGY, "PostgreSQL", Map.of());

        assertThat(retrieval.retrieve(" ", 5).getNodes()).isEmpty();
        assertThat(retrieval.retrieve("postgresql", 0).getNodes()).isEmpty();
    }
}
