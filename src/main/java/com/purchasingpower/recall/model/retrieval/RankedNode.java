package com.purchasingpower.recall.model.retrieval;

import com.purchasingpower.recall.core.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedNode {

    private String nodeId;
    private String label;
    private NodeType type;

    /**
     * Confidence with decay projected to query time.
     */
    private double confidence;

    private double importanceScore;

    /**
     * Combined ordering score.
     */
    private double score;
}
