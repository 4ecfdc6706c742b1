package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.model.feedback.UsageFeedback;

import java.util.List;

/**
 * Confidence feedback from outside the reflection cycle: a user confirming a
 * node, an operator reinforcing one, or a response that used some nodes.
 *
 * @since 1.0.0
 */
public interface NodeFeedbackService {

    /**
     * Apply a reinforcement. A deprecated node is reactivated once it is back
     * at or above the deprecation threshold.
     *
     * @return post-state of the node
     * @throws com.purchasingpower.recall.exception.NodeNotFoundException     if absent
     * @throws com.purchasingpower.recall.exception.InvalidOperatorException if the node cannot be reactivated
     */
    KnowledgeNode reinforce(String nodeId);

    /**
     * Apply a user confirmation to an active node.
     *
     * @return post-state of the node
     * @throws com.purchasingpower.recall.exception.NodeNotFoundException     if absent
     * @throws com.purchasingpower.recall.exception.InvalidOperatorException if the node is deprecated
     */
    KnowledgeNode confirm(String nodeId);

    /**
     * Reinforce each active node a response drew on, once per id. Unknown and
     * deprecated ids are skipped, never reactivated.
     */
    UsageFeedback boostUsed(List<String> nodeIds);
}
