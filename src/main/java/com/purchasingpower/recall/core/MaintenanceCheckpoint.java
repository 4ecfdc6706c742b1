package com.purchasingpower.recall.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress marker of a maintenance pass.
 *
 * <p>{@code lastCompletedStage} holds the name of the last stage that finished.
 * A checkpoint whose last stage is the final one describes a completed pass.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceCheckpoint {

    private String passId;

    /**
     * The "now" every stage of the pass evaluates decay against.
     */
    private Instant passTime;

    private String lastCompletedStage;

    private boolean completed;

    public MaintenanceCheckpoint copy() {
        return new MaintenanceCheckpoint(passId, passTime, lastCompletedStage, completed);
    }
}
