package com.purchasingpower.recall.reflection;

import com.purchasingpower.recall.maintenance.MaintenanceReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReflectionResult {

    private String cycleId;
    private String sessionId;
    private ReflectionOutcome outcome;

    /**
     * Why the cycle did not commit, null when it did.
     */
    private String reason;

    private int interactions;
    private Double qualityScore;
    private int learningsApplied;
    private int correctionsApplied;
    private int insightsAdded;
    private int insightsDropped;

    private MaintenanceReport maintenance;

    public static ReflectionResult skipped(String sessionId, ReflectionState busyWith) {
        return ReflectionResult.builder()
            .sessionId(sessionId)
            .outcome(ReflectionOutcome.SKIPPED)
            .reason("cycle already running (" + busyWith + ")")
            .build();
    }

    public boolean isCommitted() {
        return outcome == ReflectionOutcome.COMMITTED;
    }
}
