package org.optiroute.routing.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed reference ceilings that map raw metrics into {@code [0, 1]} sub-scores.
 *
 * <p>Scores are relative to these ceilings, not to the candidate set, so a route scores the same
 * in every call.</p>
 */
@Value
@Builder(toBuilder = true)
public class ScoringCeilings {
    @Builder.Default
    double costCeiling = 100_000.0d;
    @Builder.Default
    double durationCeilingHours = 720.0d;
    @Builder.Default
    double co2CeilingKg = 50_000.0d;

    public static ScoringCeilings defaults() {
        return ScoringCeilings.builder().build();
    }

    /**
     * Validates ceilings.
     */
    public ScoringCeilings validate() {
        if (!(costCeiling > 0.0d) || !(durationCeilingHours > 0.0d) || !(co2CeilingKg > 0.0d)) {
            throw new IllegalArgumentException("scoring ceilings must be > 0");
        }
        return this;
    }
}
