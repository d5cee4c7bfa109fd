package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.core.geo.GeoPoint;

import java.util.List;

/**
 * One delivery stop requested by the caller.
 */
@Value
@Builder(toBuilder = true)
public class Destination {
    /** Caller-assigned id, unique within one request. */
    String id;
    /** Stop coordinates. */
    GeoPoint location;
    /** Free-form postal address. */
    String address;
    /** Delivery priority; {@code null} is treated as {@link Priority#MEDIUM}. */
    Priority priority;
    /** Service window, or {@code null} when unconstrained. */
    TimeWindow timeWindow;
    /** On-site service time in minutes. */
    double serviceTimeMinutes;
    /** Shipment weight in kilograms. */
    double weightKg;
    /** Shipment volume in cubic meters. */
    double volumeM3;
    /** Free-form handling requirements (refrigerated, tail-lift, ...). */
    @Singular
    List<String> specialRequirements;

    /**
     * Returns the declared priority or MEDIUM when none was given.
     */
    public Priority effectivePriority() {
        return priority == null ? Priority.MEDIUM : priority;
    }
}
