package org.optiroute.routing.recommendation;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds of the recommendation rule table.
 */
@Value
@Builder(toBuilder = true)
public class RecommendationConfig {
    public static final double DEFAULT_CONGESTION_THRESHOLD = 0.7d;
    public static final double DEFAULT_FUEL_PRICE_CEILING = 25.0d;

    @Builder.Default
    double congestionThreshold = DEFAULT_CONGESTION_THRESHOLD;
    /** Unit fuel price above which a fleet change is suggested. */
    @Builder.Default
    double fuelPriceCeiling = DEFAULT_FUEL_PRICE_CEILING;

    public static RecommendationConfig defaults() {
        return RecommendationConfig.builder().build();
    }

    /**
     * Validates thresholds.
     */
    public RecommendationConfig validate() {
        if (!(congestionThreshold >= 0.0d && congestionThreshold <= 1.0d)) {
            throw new IllegalArgumentException("congestionThreshold must be in [0, 1]");
        }
        if (!(fuelPriceCeiling >= 0.0d)) {
            throw new IllegalArgumentException("fuelPriceCeiling must be >= 0");
        }
        return this;
    }
}
