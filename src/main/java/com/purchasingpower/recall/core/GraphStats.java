package com.purchasingpower.recall.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Summary counters over the graph.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStats {

    private int totalNodes;
    private int activeNodes;
    private int deprecatedNodes;
    private int totalEdges;
    private double averageConfidence;
    private int contradictions;

    @Builder.Default
    private Map<String, Integer> nodeTypes = new TreeMap<>();

    private String lastMaintenancePassId;
}
