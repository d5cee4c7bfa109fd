package org.optiroute.routing.multimodal;

import lombok.Builder;
import lombok.Value;

/**
 * One mode and carrier segment of a multimodal route.
 */
@Value
@Builder(toBuilder = true)
public class TransportLeg {
    /** 1-based position within the route. */
    int sequence;
    TransportMode mode;
    ServiceType serviceType;
    TransportNode origin;
    TransportNode destination;
    String carrier;
    double distanceKm;
    /** Line-haul plus handling time. */
    double durationHours;
    double cost;
    double co2Kg;
}
