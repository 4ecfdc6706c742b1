package com.purchasingpower.recall.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.recall.core.ConfidenceOperator;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.NodeFeedbackService;
import com.purchasingpower.recall.model.feedback.UsageFeedback;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Feedback applied straight to the graph store.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeFeedbackServiceImpl implements NodeFeedbackService {

    private final GraphStore graphStore;

    @Override
    public KnowledgeNode reinforce(String nodeId) {
        double confidence = graphStore.applyConfidenceOp(nodeId, ConfidenceOperator.reinforcement());
        log.info("👍 Node {} reinforced (conf={})", nodeId, String.format("%.3f", confidence));
        return graphStore.getNode(nodeId);
    }

    @Override
    public KnowledgeNode confirm(String nodeId) {
        double confidence = graphStore.applyConfidenceOp(nodeId, ConfidenceOperator.confirmation());
        log.info("✔️ Node {} confirmed (conf={})", nodeId, String.format("%.3f", confidence));
        return graphStore.getNode(nodeId);
    }

    @Override
    public UsageFeedback boostUsed(List<String> nodeIds) {
        Preconditions.checkNotNull(nodeIds, "Node ids are required");

        // all or nothing
        return graphStore.inTransaction(() -> {
            UsageFeedback feedback = new UsageFeedback();
            for (String nodeId : new LinkedHashSet<>(nodeIds)) {
                Optional<KnowledgeNode> node = graphStore.findNode(nodeId).filter(KnowledgeNode::isActive);
                if (node.isEmpty()) {
                    feedback.getSkipped().add(nodeId);
                    continue;
                }
                graphStore.applyConfidenceOp(nodeId, ConfidenceOperator.reinforcement());
                feedback.getBoosted().add(nodeId);
            }
            log.debug("Usage boost: {} boosted, {} skipped", feedback.getBoosted().size(), feedback.getSkipped().size());
            return feedback;
        });
    }
}
