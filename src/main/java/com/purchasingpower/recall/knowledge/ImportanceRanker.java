package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.core.GraphSnapshot;

/**
 * Link-analysis importance over the active subgraph.
 *
 * <p>Scores only order retrieval results. Ranking never changes confidence.
 *
 * @since 1.0.0
 */
public interface ImportanceRanker {

    /**
     * Rank the active nodes of a snapshot and cache the result as the latest scores.
     */
    ImportanceScores rank(GraphSnapshot snapshot);

    /**
     * Scores from the most recent {@link #rank(GraphSnapshot)} call, empty before the first one.
     */
    ImportanceScores latest();
}
