package com.purchasingpower.recall.knowledge.impl;

import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.core.KnowledgeEdge;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.knowledge.ConfidenceEngine;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.KnowledgeIngestionService;
import com.purchasingpower.recall.knowledge.LabelNormalizer;
import com.purchasingpower.recall.knowledge.RelationshipDirection;
import com.purchasingpower.recall.model.extraction.CandidateEdge;
import com.purchasingpower.recall.model.extraction.CandidateNode;
import com.purchasingpower.recall.model.extraction.ExtractionBatch;
import com.purchasingpower.recall.model.extraction.IngestionResult;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dedup-on-write ingestion of extraction batches.
 *
 * <p>Edge endpoints are resolved against the batch's own nodes first, then
 * against active nodes of any type. Edges whose endpoints cannot be resolved
 * are skipped. Afterwards relates_to edges are inferred one hop out from the
 * batch's nodes, at inferred confidence.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class KnowledgeIngestionServiceImpl implements KnowledgeIngestionService {

    static final double EDGE_REINFORCEMENT = 0.1;
    static final String ATTR_INFERRED = "inferred";
    static final String ATTR_CONFIDENCE = "confidence";

    private final GraphStore graphStore;
    private final VectorSimilarityClient vectorClient;
    private final CollaboratorGuard guard;
    private final Validator validator;
    private final Duration vectorTimeout;

    public KnowledgeIngestionServiceImpl(GraphStore graphStore,
                                         VectorSimilarityClient vectorClient,
                                         CollaboratorGuard guard,
                                         Validator validator,
                                         AppProperties properties) {
        this.graphStore = graphStore;
        this.vectorClient = vectorClient;
        this.guard = guard;
        this.validator = validator;
        this.vectorTimeout = Duration.ofMillis(properties.getVector().getTimeoutMs());
    }

    @Override
    public IngestionResult ingest(ExtractionBatch batch) {
        validate(batch);

        long startTime = System.currentTimeMillis();
        List<String> created = new ArrayList<>();

        IngestionResult result = graphStore.inTransaction(() -> apply(batch, created));

        log.info("✅ Ingested batch {}: {} new / {} resolved nodes, {} new / {} reinforced / {} skipped / {} inferred edges ({}ms)",
            batch.getSourceInteractionId(),
            result.getNodesCreated(), result.getNodesResolved(),
            result.getEdgesCreated(), result.getEdgesReinforced(), result.getEdgesSkipped(), result.getEdgesInferred(),
            System.currentTimeMillis() - startTime);

        indexNewNodes(created);
        return result;
    }

    private IngestionResult apply(ExtractionBatch batch, List<String> created) {
        IngestionResult result = IngestionResult.builder().build();
        Map<String, String> batchLabels = new HashMap<>();

        Map<String, String> provenance = new LinkedHashMap<>();
        if (batch.getSourceInteractionId() != null) {
            provenance.put("sourceInteractionId", batch.getSourceInteractionId());
        }
        if (batch.getSessionId() != null) {
            provenance.put("sessionId", batch.getSessionId());
        }

        for (CandidateNode candidate : batch.getNodes()) {
            boolean exists = graphStore.findActiveByLabel(candidate.getType(), candidate.getLabel()).isPresent();
            double initial = candidate.getConfidenceHint() != null
                ? candidate.getConfidenceHint()
                : ConfidenceEngine.INITIAL_CONFIDENCE;

            if (!exists && ConfidenceEngine.isBelowThreshold(initial)) {
                log.debug("Skipping '{}': confidence hint {} below threshold", candidate.getLabel(), initial);
                continue;
            }

            String id = graphStore.upsertNode(candidate.getType(), candidate.getLabel(), provenance, initial);
            if (exists) {
                result.setNodesResolved(result.getNodesResolved() + 1);
            } else {
                result.setNodesCreated(result.getNodesCreated() + 1);
                created.add(id);
            }
            result.getNodeIds().add(id);
            batchLabels.putIfAbsent(LabelNormalizer.normalize(candidate.getLabel()), id);
        }

        for (CandidateEdge candidate : batch.getEdges()) {
            Optional<String> source = resolve(candidate.getSourceLabel(), batchLabels);
            Optional<String> target = resolve(candidate.getTargetLabel(), batchLabels);

            if (source.isEmpty() || target.isEmpty() || source.get().equals(target.get())) {
                log.debug("Skipping edge '{}' -[{}]-> '{}': unresolved endpoint",
                    candidate.getSourceLabel(), candidate.getRelation().value(), candidate.getTargetLabel());
                result.setEdgesSkipped(result.getEdgesSkipped() + 1);
                continue;
            }

            KnowledgeEdge edge = graphStore.addEdge(source.get(), target.get(), candidate.getRelation(),
                EDGE_REINFORCEMENT, provenance);
            if (edge.getWeight() > KnowledgeEdge.DEFAULT_WEIGHT) {
                result.setEdgesReinforced(result.getEdgesReinforced() + 1);
            } else {
                result.setEdgesCreated(result.getEdgesCreated() + 1);
            }
        }

        inferRelated(result, provenance);
        return result;
    }

    /**
     * One step of relates_to transitivity around the batch's nodes: for
     * {@code n -> m} of any relation and {@code m -relates_to-> k}, add an
     * inferred {@code n -relates_to-> k} unless {@code n} already links to {@code k}.
     */
    private void inferRelated(IngestionResult result, Map<String, String> provenance) {
        Map<String, String> attributes = new LinkedHashMap<>(provenance);
        attributes.put(ATTR_INFERRED, "true");
        attributes.put(ATTR_CONFIDENCE, String.valueOf(ConfidenceEngine.INFERRED_CONFIDENCE));

        for (String nodeId : new LinkedHashSet<>(result.getNodeIds())) {
            List<Neighbor> outgoing = graphStore.neighbors(nodeId, RelationshipDirection.OUTGOING, null);
            Set<String> linked = outgoing.stream()
                .map(n -> n.node().getId())
                .collect(Collectors.toCollection(HashSet::new));

            for (Neighbor first : outgoing) {
                if (!first.node().isActive()) {
                    continue;
                }
                List<Neighbor> related = graphStore.neighbors(first.node().getId(), RelationshipDirection.OUTGOING,
                    Set.of(RelationType.RELATES_TO));
                for (Neighbor second : related) {
                    String targetId = second.node().getId();
                    if (targetId.equals(nodeId) || !second.node().isActive() || !linked.add(targetId)) {
                        continue;
                    }
                    graphStore.addEdge(nodeId, targetId, RelationType.RELATES_TO, 0.0, attributes);
                    result.setEdgesInferred(result.getEdgesInferred() + 1);
                }
            }
        }
        if (result.getEdgesInferred() > 0) {
            log.debug("Inferred {} relates_to edges", result.getEdgesInferred());
        }
    }

    private Optional<String> resolve(String label, Map<String, String> batchLabels) {
        String fromBatch = batchLabels.get(LabelNormalizer.normalize(label));
        if (fromBatch != null) {
            return Optional.of(fromBatch);
        }
        return graphStore.findActiveByLabel(label).map(KnowledgeNode::getId);
    }

    private void validate(ExtractionBatch batch) {
        if (batch == null) {
            throw new CollaboratorMalformedException("Extraction batch is missing", List.of());
        }
        List<String> violations = validator.validate(batch).stream()
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .sorted()
            .collect(Collectors.toList());
        if (!violations.isEmpty()) {
            log.warn("⚠️ Rejected extraction batch {}: {}", batch.getSourceInteractionId(), violations);
            throw new CollaboratorMalformedException("Invalid extraction batch", violations);
        }
    }

    private void indexNewNodes(List<String> nodeIds) {
        for (String nodeId : nodeIds) {
            Optional<KnowledgeNode> node = graphStore.findNode(nodeId);
            if (node.isEmpty()) {
                continue;
            }
            try {
                guard.run("vector-store", vectorTimeout,
                    () -> vectorClient.index(VectorSimilarityClient.NODES_COLLECTION, nodeId, node.get().getLabel()));
            } catch (CollaboratorTimeoutException e) {
                log.warn("⚠️ Node indexing stopped after failure: {}", e.getMessage());
                return;
            }
        }
    }
}
