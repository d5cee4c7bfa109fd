package org.optiroute.routing.solver;

import lombok.Builder;
import lombok.Value;
import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.model.Priority;
import org.optiroute.routing.model.TimeWindow;

import java.time.Instant;

/**
 * One visited destination of a candidate route.
 */
@Value
@Builder(toBuilder = true)
public class Stop {
    String destinationId;
    GeoPoint location;
    Priority priority;
    /** Delivery window; {@code null} when the destination is unconstrained. */
    TimeWindow timeWindow;

    Instant arrivalTime;
    Instant departureTime;
    double serviceTimeMinutes;
    double waitingMinutes;
    /** Minutes past the window end at arrival; 0 when on time. */
    double latenessMinutes;

    /** Road distance from the previous stop, or from the origin for the first stop. */
    double distanceFromPreviousKm;
    double travelMinutes;
    /** Cost attributed to this stop; 0 until the route is costed. */
    double incrementalCost;

    double weightKg;
    double volumeM3;

    /**
     * Returns true when the stop was reached after its window closed.
     */
    public boolean isLate() {
        return latenessMinutes > 0.0d;
    }
}
