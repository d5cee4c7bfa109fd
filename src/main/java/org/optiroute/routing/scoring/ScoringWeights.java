package org.optiroute.routing.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Operator priorities for ranking. Weights are relative and need not sum to 1.
 */
@Value
@Builder
public class ScoringWeights {
    double costPriority;
    double speedPriority;
    double sustainabilityPriority;

    /**
     * Equal priorities.
     */
    public static ScoringWeights balanced() {
        return new ScoringWeights(1.0d, 1.0d, 1.0d);
    }

    public static ScoringWeights of(double costPriority, double speedPriority, double sustainabilityPriority) {
        return new ScoringWeights(costPriority, speedPriority, sustainabilityPriority);
    }

    /**
     * Validates weights.
     *
     * @throws ScoringException when a weight is negative or non-finite, or all are zero.
     */
    public ScoringWeights validate() {
        if (!valid(costPriority) || !valid(speedPriority) || !valid(sustainabilityPriority)) {
            throw new ScoringException(ScoringException.REASON_INVALID_WEIGHTS, "weights must be finite and >= 0");
        }
        if (costPriority + speedPriority + sustainabilityPriority == 0.0d) {
            throw new ScoringException(ScoringException.REASON_INVALID_WEIGHTS, "at least one weight must be > 0");
        }
        return this;
    }

    private static boolean valid(double weight) {
        return weight >= 0.0d && Double.isFinite(weight);
    }
}
