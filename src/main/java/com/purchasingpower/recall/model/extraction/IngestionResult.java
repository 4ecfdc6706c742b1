package com.purchasingpower.recall.model.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying one extraction batch.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private int nodesCreated;
    private int nodesResolved;
    private int edgesCreated;
    private int edgesReinforced;
    private int edgesSkipped;

    /**
     * Relates_to edges added by transitive inference.
     */
    private int edgesInferred;

    /**
     * Node id per candidate node, in batch order.
     */
    @Builder.Default
    private List<String> nodeIds = new ArrayList<>();

    public boolean hasNewKnowledge() {
        return nodesCreated > 0 || edgesCreated > 0;
    }
}
