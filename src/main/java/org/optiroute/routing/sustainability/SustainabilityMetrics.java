package org.optiroute.routing.sustainability;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Environmental metrics of one route.
 */
@Value
@Builder
public class SustainabilityMetrics {
    double co2EmissionsKg;
    /** Distance per fuel unit; 0 when no fuel was used. */
    double fuelEfficiency;
    /** Score in {@code [0, 100]}. */
    double environmentalScore;
    @Singular
    List<String> recommendations;
}
