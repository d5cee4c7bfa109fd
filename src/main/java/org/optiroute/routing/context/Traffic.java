package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Traffic snapshot for the request geography.
 */
@Value
@Builder(toBuilder = true)
public class Traffic {
    /** Congestion level in {@code [0, 1]}. */
    double congestionLevel;
    /** Average free-flow-adjusted speed in km/h. */
    double averageSpeedKmh;
    @Singular
    List<TrafficIncident> incidents;
}
