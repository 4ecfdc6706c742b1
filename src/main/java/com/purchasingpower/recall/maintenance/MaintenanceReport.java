package com.purchasingpower.recall.maintenance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What one maintenance pass did.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceReport {

    private String passId;
    private Instant passTime;

    /**
     * The pass continued an interrupted one instead of starting fresh.
     */
    private boolean resumed;

    private int decayed;
    private int merged;
    private int pruned;
    private int ranked;

    /**
     * Vector similarity was unavailable; only exact label matches were merged.
     */
    private boolean vectorDegraded;

    @Builder.Default
    private List<MaintenanceStage> completedStages = new ArrayList<>();

    private long durationMs;

    /**
     * The snapshot was saved after the pass.
     */
    private boolean persisted;
}
