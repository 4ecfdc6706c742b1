package com.purchasingpower.recall.model.synthesis;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured reflection over one session, produced by the LLM.
 *
 * <p>Learnings, corrections and insights become graph mutations. Summary,
 * patterns and knowledge gaps only go to the session journal.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSynthesis {

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double qualityScore;

    @Valid
    @NotNull
    @Builder.Default
    private List<Learning> learnings = new ArrayList<>();

    @Valid
    @NotNull
    @Builder.Default
    private List<Correction> corrections = new ArrayList<>();

    @Valid
    @NotNull
    @Builder.Default
    private List<Insight> insights = new ArrayList<>();

    private String sessionSummary;

    @Valid
    @NotNull
    @Builder.Default
    private List<Pattern> patterns = new ArrayList<>();

    @Valid
    @NotNull
    @Builder.Default
    private List<KnowledgeGap> knowledgeGaps = new ArrayList<>();
}
