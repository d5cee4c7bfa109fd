package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Value;
import org.optiroute.core.geo.GeoPoint;

/**
 * Depot or pickup point where a route starts.
 */
@Value
@Builder
public class Origin {
    /** Depot coordinates. */
    GeoPoint location;
    /** Free-form postal address. */
    String address;
    /** Operating window of the depot, or {@code null} when always open. */
    TimeWindow timeWindow;
}
