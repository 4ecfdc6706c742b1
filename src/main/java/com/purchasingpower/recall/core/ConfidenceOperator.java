package com.purchasingpower.recall.core;

import com.google.common.base.Preconditions;

/**
 * Evidence applied to a node's confidence.
 *
 * <p>Only {@link Kind#DECAY} carries a magnitude (elapsed days); the other kinds
 * apply a fixed delta defined by the confidence engine.
 *
 * @param kind        operator kind
 * @param elapsedDays elapsed days for decay, 0 otherwise
 * @since 1.0.0
 */
public record ConfidenceOperator(Kind kind, double elapsedDays) {

    public ConfidenceOperator {
        Preconditions.checkNotNull(kind, "Operator kind is required");
        Preconditions.checkArgument(elapsedDays >= 0.0, "Elapsed days must be >= 0, got %s", elapsedDays);
    }

    public static ConfidenceOperator correction() {
        return new ConfidenceOperator(Kind.CORRECTION, 0.0);
    }

    public static ConfidenceOperator confirmation() {
        return new ConfidenceOperator(Kind.CONFIRMATION, 0.0);
    }

    public static ConfidenceOperator reinforcement() {
        return new ConfidenceOperator(Kind.REINFORCEMENT, 0.0);
    }

    public static ConfidenceOperator decay(double elapsedDays) {
        return new ConfidenceOperator(Kind.DECAY, elapsedDays);
    }

    /**
     * Whether this operator may touch a deprecated node.
     */
    public boolean isExplicitReinforcement() {
        return kind == Kind.REINFORCEMENT;
    }

    public enum Kind {
        CORRECTION,
        CONFIRMATION,
        DECAY,
        REINFORCEMENT
    }
}
