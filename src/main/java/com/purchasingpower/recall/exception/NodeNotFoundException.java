package com.purchasingpower.recall.exception;

import lombok.Getter;

/**
 * A referenced node id does not exist. Always a caller bug.
 */
@Getter
public class NodeNotFoundException extends KnowledgeGraphException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }
}
