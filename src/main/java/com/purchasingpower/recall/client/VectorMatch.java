package com.purchasingpower.recall.client;

/**
 * One hit of a similarity query.
 *
 * @param itemId id the item was indexed under (a node id)
 * @param score  similarity in [0, 1], higher is closer
 */
public record VectorMatch(String itemId, double score) {
}
