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
 * A directed, typed edge between two nodes.
 *
 * <p>At most one edge exists per (source, target, relation) triple.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeEdge {

    public static final double DEFAULT_WEIGHT = 1.0;

    private String source;

    private String target;

    private RelationType relation;

    @Builder.Default
    private double weight = DEFAULT_WEIGHT;

    private Instant createdAt;

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    @JsonIgnore
    public EdgeKey key() {
        return new EdgeKey(source, target, relation);
    }

    public KnowledgeEdge copy() {
        return KnowledgeEdge.builder()
            .source(source)
            .target(target)
            .relation(relation)
            .weight(weight)
            .createdAt(createdAt)
            .attributes(new LinkedHashMap<>(attributes))
            .build();
    }

    /**
     * Identity of an edge: the (source, target, relation) triple.
     */
    public record EdgeKey(String source, String target, RelationType relation) {
    }
}
