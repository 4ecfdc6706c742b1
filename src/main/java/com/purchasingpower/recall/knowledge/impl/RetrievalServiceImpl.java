package com.purchasingpower.recall.knowledge.impl;

import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.VectorMatch;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.knowledge.ConfidenceEngine;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.ImportanceRanker;
import com.purchasingpower.recall.knowledge.ImportanceScores;
import com.purchasingpower.recall.knowledge.LabelNormalizer;
import com.purchasingpower.recall.knowledge.MistakeIndex;
import com.purchasingpower.recall.knowledge.RelationshipDirection;
import com.purchasingpower.recall.knowledge.RetrievalService;
import com.purchasingpower.recall.model.retrieval.MistakeWarning;
import com.purchasingpower.recall.model.retrieval.RankedNode;
import com.purchasingpower.recall.model.retrieval.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Query-time ranking of knowledge.
 *
 * <p>Seeds come from vector similarity and label containment, then grow one hop
 * along edges in both directions. Each active candidate is scored:
 *
 * <pre>
 *   0.5 * confidence + 0.3 * min(100 * importance, 1) + 0.2 * recency
 * </pre>
 *
 * where confidence is decayed up to now without touching the node and recency
 * halves every 30 days since the node was last updated.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class RetrievalServiceImpl implements RetrievalService {

    static final double CONFIDENCE_WEIGHT = 0.5;
    static final double IMPORTANCE_WEIGHT = 0.3;
    static final double RECENCY_WEIGHT = 0.2;
    static final double IMPORTANCE_SCALE = 100.0;
    static final double RECENCY_HALF_LIFE_DAYS = 30.0;

    private static final double SEED_SIMILARITY_THRESHOLD = 0.3;
    private static final int MIN_CONTAINMENT_LABEL_LENGTH = 3;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final GraphStore graphStore;
    private final ImportanceRanker importanceRanker;
    private final MistakeIndex mistakeIndex;
    private final VectorSimilarityClient vectorClient;
    private final CollaboratorGuard guard;
    private final Clock clock;
    private final Duration vectorTimeout;

    public RetrievalServiceImpl(GraphStore graphStore,
                                ImportanceRanker importanceRanker,
                                MistakeIndex mistakeIndex,
                                VectorSimilarityClient vectorClient,
                                CollaboratorGuard guard,
                                Clock clock,
                                AppProperties properties) {
        this.graphStore = graphStore;
        this.importanceRanker = importanceRanker;
        this.mistakeIndex = mistakeIndex;
        this.vectorClient = vectorClient;
        this.guard = guard;
        this.clock = clock;
        this.vectorTimeout = Duration.ofMillis(properties.getVector().getTimeoutMs());
    }

    @Override
    public RetrievalResult retrieve(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return RetrievalResult.builder().query(query).build();
        }

        Instant now = clock.instant();
        List<KnowledgeNode> active = graphStore.activeNodes();

        Set<String> seeds = new LinkedHashSet<>();
        seeds.addAll(vectorSeeds(query, limit));
        seeds.addAll(labelSeeds(query, active));

        Map<String, KnowledgeNode> candidates = new LinkedHashMap<>();
        for (String seedId : seeds) {
            graphStore.findNode(seedId).filter(KnowledgeNode::isActive).ifPresent(seed -> {
                candidates.putIfAbsent(seed.getId(), seed);
                for (Neighbor neighbor : graphStore.neighbors(seed.getId(), RelationshipDirection.BOTH, null)) {
                    if (neighbor.node().isActive()) {
                        candidates.putIfAbsent(neighbor.node().getId(), neighbor.node());
                    }
                }
            });
        }

        ImportanceScores importance = currentImportance(active);
        List<RankedNode> ranked = candidates.values().stream()
            .map(node -> score(node, importance, now))
            .sorted(Comparator.comparingDouble(RankedNode::getScore).reversed()
                .thenComparing(RankedNode::getNodeId))
            .limit(limit)
            .collect(Collectors.toList());

        List<MistakeWarning> warnings = mistakeIndex.warningsFor(query);

        log.info("🔍 Retrieved {} of {} candidates for '{}' ({} warnings)",
            ranked.size(), candidates.size(), query, warnings.size());

        return RetrievalResult.builder()
            .query(query)
            .nodes(ranked)
            .warnings(warnings)
            .build();
    }

    private List<String> vectorSeeds(String query, int limit) {
        try {
            return guard.call("vector-store", vectorTimeout,
                    () -> vectorClient.similar(VectorSimilarityClient.NODES_COLLECTION, query, limit, SEED_SIMILARITY_THRESHOLD))
                .stream()
                .map(VectorMatch::itemId)
                .collect(Collectors.toList());
        } catch (CollaboratorTimeoutException e) {
            log.warn("⚠️ Vector seeding unavailable, using label matches only: {}", e.getMessage());
            return List.of();
        }
    }

    private static List<String> labelSeeds(String query, List<KnowledgeNode> active) {
        String normalizedQuery = LabelNormalizer.normalize(query);
        List<String> seeds = new ArrayList<>();
        for (KnowledgeNode node : active) {
            String label = LabelNormalizer.normalize(node.getLabel());
            if (label.length() < MIN_CONTAINMENT_LABEL_LENGTH) {
                continue;
            }
            if (normalizedQuery.contains(label) || label.contains(normalizedQuery)) {
                seeds.add(node.getId());
            }
        }
        return seeds;
    }

    private ImportanceScores currentImportance(List<KnowledgeNode> active) {
        ImportanceScores latest = importanceRanker.latest();
        if (latest.size() == 0 && !active.isEmpty()) {
            return importanceRanker.rank(graphStore.snapshot());
        }
        return latest;
    }

    private static RankedNode score(KnowledgeNode node, ImportanceScores importance, Instant now) {
        double confidence = ConfidenceEngine.projectDecay(node, now);
        double importanceScore = importance.scoreOf(node.getId());

        double ageDays = node.getUpdatedAt() != null && now.isAfter(node.getUpdatedAt())
            ? Duration.between(node.getUpdatedAt(), now).toMillis() / MILLIS_PER_DAY
            : 0.0;
        double recency = Math.pow(0.5, ageDays / RECENCY_HALF_LIFE_DAYS);

        double score = CONFIDENCE_WEIGHT * confidence
            + IMPORTANCE_WEIGHT * Math.min(IMPORTANCE_SCALE * importanceScore, 1.0)
            + RECENCY_WEIGHT * recency;

        return RankedNode.builder()
            .nodeId(node.getId())
            .label(node.getLabel())
            .type(node.getType())
            .confidence(confidence)
            .importanceScore(importanceScore)
            .score(score)
            .build();
    }
}
