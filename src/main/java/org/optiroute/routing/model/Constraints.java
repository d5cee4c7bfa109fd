package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Value;

/**
 * Hard route limits and routing preferences.
 *
 * <p>Duration and distance limits default to {@code +INF} (unbounded).</p>
 */
@Value
@Builder(toBuilder = true)
public class Constraints {
    /** Maximum route duration in minutes. */
    @Builder.Default
    double maxRouteDurationMinutes = Double.POSITIVE_INFINITY;
    /** Maximum route distance in kilometers. */
    @Builder.Default
    double maxDistanceKm = Double.POSITIVE_INFINITY;
    /** Skip toll roads (zeroes toll cost). */
    boolean avoidTolls;
    /** Skip highways (reduces effective speed). */
    boolean avoidHighways;
    /** Prefer routes passing charging infrastructure. */
    boolean preferElectricCharging;

    /**
     * Returns constraints with no limits and no preferences.
     */
    public static Constraints unbounded() {
        return Constraints.builder().build();
    }
}
