package com.purchasingpower.recall.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.configuration.GraphProperties;
import com.purchasingpower.recall.core.GraphSnapshot;
import com.purchasingpower.recall.core.KnowledgeEdge;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.knowledge.ImportanceRanker;
import com.purchasingpower.recall.knowledge.ImportanceScores;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Weighted PageRank by power iteration.
 *
 * <p>Only active nodes and edges between active nodes take part. Parallel edges
 * between the same pair (different relations) add their weights. Mass held by
 * nodes without outgoing edges is spread uniformly. Nodes are indexed in id
 * order so the same snapshot always yields the same scores.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class PageRankImportanceRanker implements ImportanceRanker {

    private final double damping;
    private final int maxIterations;
    private final double tolerance;

    private final AtomicReference<ImportanceScores> latest = new AtomicReference<>(ImportanceScores.empty());

    public PageRankImportanceRanker(AppProperties properties) {
        GraphProperties graph = properties.getGraph();
        Preconditions.checkArgument(graph.getDamping() >= 0.0 && graph.getDamping() <= 1.0,
            "Damping must be in [0, 1], got %s", graph.getDamping());
        this.damping = graph.getDamping();
        this.maxIterations = graph.getMaxIterations();
        this.tolerance = graph.getTolerance();
    }

    @Override
    public ImportanceScores rank(GraphSnapshot snapshot) {
        List<String> ids = snapshot.getNodes().stream()
            .filter(KnowledgeNode::isActive)
            .map(KnowledgeNode::getId)
            .sorted()
            .collect(Collectors.toList());

        int n = ids.size();
        if (n == 0) {
            ImportanceScores empty = ImportanceScores.empty();
            latest.set(empty);
            return empty;
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(ids.get(i), i);
        }

        // Summed weights per (source, target) pair, iterated in a fixed order
        List<Map<Integer, Double>> outgoing = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            outgoing.add(new TreeMap<>());
        }
        double[] outWeight = new double[n];
        for (KnowledgeEdge edge : snapshot.getEdges()) {
            Integer src = index.get(edge.getSource());
            Integer dst = index.get(edge.getTarget());
            if (src == null || dst == null || edge.getWeight() <= 0.0) {
                continue;
            }
            outgoing.get(src).merge(dst, edge.getWeight(), Double::sum);
            outWeight[src] += edge.getWeight();
        }

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);

        int iterations = 0;
        boolean converged = false;
        while (iterations < maxIterations) {
            iterations++;

            double danglingMass = 0.0;
            for (int i = 0; i < n; i++) {
                if (outWeight[i] == 0.0) {
                    danglingMass += rank[i];
                }
            }

            double base = (1.0 - damping) / n + damping * danglingMass / n;
            double[] next = new double[n];
            Arrays.fill(next, base);
            for (int i = 0; i < n; i++) {
                if (outWeight[i] == 0.0) {
                    continue;
                }
                double share = damping * rank[i] / outWeight[i];
                for (Map.Entry<Integer, Double> out : outgoing.get(i).entrySet()) {
                    next[out.getKey()] += share * out.getValue();
                }
            }

            double delta = 0.0;
            for (int i = 0; i < n; i++) {
                delta += Math.abs(next[i] - rank[i]);
            }
            rank = next;

            if (delta < n * tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("⚠️ PageRank did not converge in {} iterations over {} nodes", maxIterations, n);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores.put(ids.get(i), rank[i]);
        }

        ImportanceScores result = new ImportanceScores(Collections.unmodifiableMap(scores), iterations, converged);
        latest.set(result);
        log.debug("Ranked {} active nodes in {} iterations", n, iterations);
        return result;
    }

    @Override
    public ImportanceScores latest() {
        return latest.get();
    }
}
