package com.purchasingpower.recall.exception;

import com.purchasingpower.recall.core.ConfidenceOperator;
import lombok.Getter;

/**
 * A confidence operator was applied to a node that cannot accept it,
 * e.g. a correction on a deprecated node.
 */
@Getter
public class InvalidOperatorException extends KnowledgeGraphException {

    private final String nodeId;
    private final ConfidenceOperator.Kind operator;

    public InvalidOperatorException(String nodeId, ConfidenceOperator.Kind operator, String reason) {
        super("Cannot apply " + operator + " to node " + nodeId + ": " + reason);
        this.nodeId = nodeId;
        this.operator = operator;
    }
}
