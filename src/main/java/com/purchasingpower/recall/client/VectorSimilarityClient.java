package com.purchasingpower.recall.client;

import java.util.List;

/**
 * Semantic similarity collaborator.
 *
 * <p>Items are indexed per collection under the id of the node they describe.
 * Implementations may block; callers go through {@link CollaboratorGuard}.
 *
 * @since 1.0.0
 */
public interface VectorSimilarityClient {

    /**
     * Node labels, used for dedup and retrieval seeding.
     */
    String NODES_COLLECTION = "graph-nodes";

    /**
     * Questions that led to corrected mistakes.
     */
    String MISTAKES_COLLECTION = "mistakes";

    /**
     * Items whose similarity to {@code text} is at least {@code threshold},
     * best first, at most {@code topK}.
     */
    List<VectorMatch> similar(String collection, String text, int topK, double threshold);

    /**
     * Index (or re-index) an item.
     */
    void index(String collection, String itemId, String text);

    void remove(String collection, String itemId);

    String getProviderName();
}
