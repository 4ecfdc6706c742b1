package com.purchasingpower.recall.knowledge;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Importance score per active node, as produced by one ranking run.
 *
 * @since 1.0.0
 */
@Getter
@ToString
@AllArgsConstructor
public class ImportanceScores {

    private final Map<String, Double> scores;
    private final int iterations;
    private final boolean converged;

    public static ImportanceScores empty() {
        return new ImportanceScores(Map.of(), 0, true);
    }

    /**
     * Score of a node, 0 for nodes that were not ranked (deprecated or unknown).
     */
    public double scoreOf(String nodeId) {
        return scores.getOrDefault(nodeId, 0.0);
    }

    public int size() {
        return scores.size();
    }
}
