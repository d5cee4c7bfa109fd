package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Value;

/**
 * Calendar-derived traffic factors for the departure instant.
 */
@Value
@Builder(toBuilder = true)
public class TimeFactors {
    private static final TimeFactors NEUTRAL = TimeFactors.builder().trafficMultiplier(1.0d).build();

    boolean rushHour;
    boolean weekend;
    boolean holiday;
    /** Multiplier applied to travel time and fuel consumption. */
    double trafficMultiplier;

    /**
     * Factors used when time-of-day signals are disabled.
     */
    public static TimeFactors neutral() {
        return NEUTRAL;
    }
}
