package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.core.geo.GeoPoint;

import java.util.List;

/**
 * Caller-supplied vehicle and driver profile for one optimization run.
 */
@Value
@Builder(toBuilder = true)
public class VehicleProfile {
    /** Vehicle id echoed on route outcomes. */
    String id;
    /** Payload capacity in kilograms. */
    double capacityKg;
    /** Cargo volume capacity in cubic meters. */
    double volumeCapacityM3;
    /** Energy source; drives consumption, price and emission factors. */
    FuelType fuelType;
    /** Last known vehicle position. */
    GeoPoint currentLocation;
    /** Assigned driver id. */
    String driverId;
    /** Driver qualifications. */
    @Singular
    List<String> driverSkills;
}
