package com.purchasingpower.recall.model.extraction;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate nodes and edges pulled out of one interaction by the external
 * extractor.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionBatch {

    private String sourceInteractionId;

    private String sessionId;

    @Valid
    @NotNull
    @Builder.Default
    private List<CandidateNode> nodes = new ArrayList<>();

    @Valid
    @NotNull
    @Builder.Default
    private List<CandidateEdge> edges = new ArrayList<>();
}
