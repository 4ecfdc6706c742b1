package com.purchasingpower.recall.maintenance;

/**
 * Stages of a maintenance pass, in execution order.
 *
 * @since 1.0.0
 */
public enum MaintenanceStage {
    DECAY,
    DEDUPLICATE,
    PRUNE,
    RERANK;

    /**
     * Stage to run after {@code lastCompleted}; {@link #DECAY} for a fresh pass.
     */
    public static MaintenanceStage after(String lastCompleted) {
        if (lastCompleted == null) {
            return DECAY;
        }
        MaintenanceStage stage = MaintenanceStage.valueOf(lastCompleted);
        return stage.isFinal() ? null : values()[stage.ordinal() + 1];
    }

    public boolean isFinal() {
        return this == RERANK;
    }
}
