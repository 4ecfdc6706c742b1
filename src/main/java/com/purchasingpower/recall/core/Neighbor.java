package com.purchasingpower.recall.core;

/**
 * An edge incident to a node together with the node at its other end.
 *
 * @since 1.0.0
 */
public record Neighbor(KnowledgeEdge edge, KnowledgeNode node) {
}
