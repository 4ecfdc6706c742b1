package com.purchasingpower.recall.persistence;

import com.purchasingpower.recall.model.synthesis.KnowledgeGap;
import com.purchasingpower.recall.model.synthesis.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalEntry {

    private String sessionId;
    private String cycleId;
    private Instant reflectedAt;
    private Double qualityScore;
    private String sessionSummary;

    private int interactions;
    private int learningsApplied;
    private int correctionsApplied;
    private int insightsAdded;
    private int insightsDropped;

    @Builder.Default
    private List<String> learnings = new ArrayList<>();

    /**
     * "wrong -> correct" lines.
     */
    @Builder.Default
    private List<String> corrections = new ArrayList<>();

    @Builder.Default
    private List<Pattern> patterns = new ArrayList<>();

    @Builder.Default
    private List<KnowledgeGap> knowledgeGaps = new ArrayList<>();

    private String maintenancePassId;
}
