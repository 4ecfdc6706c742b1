package com.purchasingpower.recall.api;

import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.NodeStatus;
import com.purchasingpower.recall.core.RelationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A node with its incident edges.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeDetails {

    private KnowledgeNode node;

    @Builder.Default
    private List<Link> links = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Link {
        private String direction;
        private RelationType relation;
        private double weight;
        private String nodeId;
        private String label;
        private NodeStatus status;
    }
}
