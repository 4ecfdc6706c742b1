package com.purchasingpower.recall.exception;

/**
 * A graph invariant was violated: duplicate edge triple, confidence out of
 * bounds, dangling edge. Fatal for the current operation; never repaired in place.
 */
public class GraphIntegrityException extends KnowledgeGraphException {

    public GraphIntegrityException(String message) {
        super(message);
    }
}
