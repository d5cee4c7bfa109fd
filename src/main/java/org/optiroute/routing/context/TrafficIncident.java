package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Value;
import org.optiroute.core.geo.GeoPoint;

/**
 * One reported traffic incident.
 */
@Value
@Builder
public class TrafficIncident {

    /**
     * Incident category.
     */
    public enum Type {
        ACCIDENT,
        CONSTRUCTION,
        WEATHER,
        OTHER
    }

    /**
     * Incident impact level.
     */
    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }

    Type type;
    Severity severity;
    GeoPoint location;
    String description;
    /** Expected remaining impact in minutes. */
    double estimatedDurationMinutes;
}
