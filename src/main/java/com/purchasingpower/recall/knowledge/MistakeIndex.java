package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.model.mistake.MistakeRecord;
import com.purchasingpower.recall.model.retrieval.MistakeWarning;

import java.util.List;

/**
 * Past mistakes, queryable by topical similarity.
 *
 * <p>A mistake lives in the graph as a {@code mistake} node with a
 * {@code corrects} edge to the node that carried the wrong claim. The vector
 * collaborator only holds the question text, keyed by mistake node id.
 *
 * @since 1.0.0
 */
public interface MistakeIndex {

    /**
     * Node that carried the wrong claim: the related node if it exists, else the
     * active node labelled with the wrong claim, else a new {@code fact} node for it.
     */
    String resolveTarget(String relatedNodeId, String wrongClaim);

    /**
     * Create the mistake node and its {@code corrects} edge. Graph-only; call
     * {@link #indexMistake(String)} once the surrounding transaction has committed.
     *
     * @return id of the mistake node
     */
    String record(MistakeRecord record);

    /**
     * Hand the mistake's question to the vector collaborator. Best effort.
     *
     * @return whether the mistake was indexed
     */
    boolean indexMistake(String mistakeNodeId);

    /**
     * Re-index every active mistake node, for a vector collaborator that lost
     * its contents (a restart with an in-memory index). Stops at the first
     * collaborator failure; the rest are retried by the next successful
     * {@link #indexMistake(String)}.
     *
     * @return number of mistakes indexed
     */
    int rebuild();

    /**
     * Warnings for past mistakes similar to {@code question}. Never fails:
     * collaborator trouble yields an empty list.
     */
    List<MistakeWarning> warningsFor(String question);

    /**
     * Render warnings as a prompt block, empty string when there are none.
     */
    String formatWarningBlock(List<MistakeWarning> warnings);
}
