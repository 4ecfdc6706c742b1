package com.purchasingpower.recall.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Detached, serializable view of the whole graph.
 *
 * <p>This is both the in-process export used by ranking and the persisted
 * document. Nodes are ordered by creation, edges by insertion.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSnapshot {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String lastMaintenancePassId;

    private MaintenanceCheckpoint maintenanceCheckpoint;

    /**
     * Reflection cycle whose mutations this snapshot includes, or null.
     */
    private String lastReflectedCycleId;

    @Builder.Default
    private List<KnowledgeNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<KnowledgeEdge> edges = new ArrayList<>();

    public static GraphSnapshot empty() {
        return GraphSnapshot.builder().build();
    }
}
