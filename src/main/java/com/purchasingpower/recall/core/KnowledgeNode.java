package com.purchasingpower.recall.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node in the knowledge graph.
 *
 * <p>Instances handed out by the {@code GraphStore} are detached copies. Mutating
 * them has no effect on the graph; all changes go through the store.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeNode {

    /**
     * Stable identifier (UUID string), never reused.
     */
    private String id;

    private NodeType type;

    /**
     * Label as first seen (original casing). Matching uses the normalized form.
     */
    private String label;

    private double confidence;

    private Instant createdAt;

    /**
     * Advanced by every confidence operator except decay.
     */
    private Instant updatedAt;

    @Builder.Default
    private NodeStatus status = NodeStatus.ACTIVE;

    /**
     * Provenance and bookkeeping, e.g. sourceInteractionId, sessionId, mergedInto.
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    /**
     * Number of write-time upserts that resolved to this node.
     */
    @Builder.Default
    private int useCount = 1;

    /**
     * Decay watermark: decay is charged from max(lastDecayAt, updatedAt) onwards.
     */
    private Instant lastDecayAt;

    /**
     * Maintenance pass that last touched this node, or null.
     */
    private String lastPassId;

    @JsonIgnore
    public boolean isActive() {
        return status == NodeStatus.ACTIVE;
    }

    public KnowledgeNode copy() {
        return KnowledgeNode.builder()
            .id(id)
            .type(type)
            .label(label)
            .confidence(confidence)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .status(status)
            .attributes(new LinkedHashMap<>(attributes))
            .useCount(useCount)
            .lastDecayAt(lastDecayAt)
            .lastPassId(lastPassId)
            .build();
    }
}
