package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Value;

/**
 * Selects which live signals feed the context snapshot.
 */
@Value
@Builder
public class RealTimeFactorFlags {
    @Builder.Default
    boolean includeTraffic = true;
    @Builder.Default
    boolean includeWeather = true;
    @Builder.Default
    boolean includeFuelPrices = true;
    @Builder.Default
    boolean includeTimeOfDay = true;

    /**
     * All signals enabled.
     */
    public static RealTimeFactorFlags all() {
        return RealTimeFactorFlags.builder().build();
    }
}
