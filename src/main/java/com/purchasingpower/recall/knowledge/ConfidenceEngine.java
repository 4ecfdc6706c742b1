package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.core.ConfidenceOperator;
import com.purchasingpower.recall.core.KnowledgeNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Confidence update algebra.
 *
 * <p>Every update is {@code clamp(current + delta(operator))} with the clamp
 * onto [0.0, 1.0]. The functions are pure; the store decides when to call them
 * and records the result.
 *
 * <pre>
 *   CORRECTION     -0.40
 *   CONFIRMATION   +0.20
 *   REINFORCEMENT  +0.03
 *   DECAY          -0.001 per elapsed day
 * </pre>
 *
 * @since 1.0.0
 */
public final class ConfidenceEngine {

    public static final double MIN_CONFIDENCE = 0.0;
    public static final double MAX_CONFIDENCE = 1.0;

    public static final double INITIAL_CONFIDENCE = 0.5;
    public static final double DEPRECATION_THRESHOLD = 0.05;

    public static final double CORRECTION_DELTA = -0.4;
    public static final double CONFIRMATION_DELTA = 0.2;
    public static final double REINFORCEMENT_DELTA = 0.03;
    public static final double DECAY_PER_DAY = 0.001;

    /**
     * Confidence given to nodes derived by inference rather than observed.
     */
    public static final double INFERRED_CONFIDENCE = 0.3;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private ConfidenceEngine() {
    }

    public static double apply(double current, ConfidenceOperator operator) {
        return clamp(current + delta(operator));
    }

    public static double delta(ConfidenceOperator operator) {
        switch (operator.kind()) {
            case CORRECTION:
                return CORRECTION_DELTA;
            case CONFIRMATION:
                return CONFIRMATION_DELTA;
            case REINFORCEMENT:
                return REINFORCEMENT_DELTA;
            case DECAY:
                return -DECAY_PER_DAY * operator.elapsedDays();
            default:
                throw new IllegalStateException("Unknown operator: " + operator.kind());
        }
    }

    public static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence is NaN");
        }
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    public static boolean isBelowThreshold(double confidence) {
        return confidence < DEPRECATION_THRESHOLD;
    }

    /**
     * Start of the interval that has not been charged decay yet.
     */
    public static Instant decayBaseline(KnowledgeNode node) {
        Instant lastDecay = node.getLastDecayAt() != null ? node.getLastDecayAt() : node.getCreatedAt();
        Instant updated = node.getUpdatedAt() != null ? node.getUpdatedAt() : lastDecay;
        if (lastDecay == null) {
            return updated;
        }
        return updated != null && updated.isAfter(lastDecay) ? updated : lastDecay;
    }

    /**
     * Days elapsed since the decay baseline, 0 if {@code now} is not after it.
     */
    public static double elapsedDays(KnowledgeNode node, Instant now) {
        Instant baseline = decayBaseline(node);
        if (baseline == null || !now.isAfter(baseline)) {
            return 0.0;
        }
        return Duration.between(baseline, now).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * Confidence the node would have after decaying up to {@code now}, without
     * touching the node.
     */
    public static double projectDecay(KnowledgeNode node, Instant now) {
        double days = elapsedDays(node, now);
        if (days <= 0.0 || !node.isActive()) {
            return node.getConfidence();
        }
        return apply(node.getConfidence(), ConfidenceOperator.decay(days));
    }
}
