package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Weather snapshot for the request geography.
 */
@Value
@Builder(toBuilder = true)
public class Weather {
    double temperatureC;
    double humidityPercent;
    double windSpeedKmh;
    double precipitationMmPerHour;
    double visibilityKm;
    RoadCondition roadCondition;
    @Singular
    List<String> warnings;
}
