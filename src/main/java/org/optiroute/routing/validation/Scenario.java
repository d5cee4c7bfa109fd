package org.optiroute.routing.validation;

import lombok.Builder;
import lombok.Value;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RoadCondition;

/**
 * What-if overrides applied to a base context. Unset overrides keep the base value.
 */
@Value
@Builder
public class Scenario {
    String name;
    /** Likelihood of the scenario in {@code [0, 1]}. */
    @Builder.Default
    double probability = 1.0d;
    Double congestionLevel;
    Double averageSpeedKmh;
    Double trafficMultiplier;
    RoadCondition roadCondition;
    /** Multiplier applied to every fuel price. */
    Double fuelPriceFactor;

    /**
     * Returns a new context with this scenario's overrides applied.
     */
    public RealTimeContext applyTo(RealTimeContext base) {
        RealTimeContext.RealTimeContextBuilder context = base.toBuilder();
        if (congestionLevel != null || averageSpeedKmh != null) {
            context.traffic(base.getTraffic().toBuilder()
                    .congestionLevel(congestionLevel != null ? congestionLevel : base.getTraffic().getCongestionLevel())
                    .averageSpeedKmh(averageSpeedKmh != null ? averageSpeedKmh : base.getTraffic().getAverageSpeedKmh())
                    .build());
        }
        if (trafficMultiplier != null) {
            context.timeFactors(base.getTimeFactors().toBuilder().trafficMultiplier(trafficMultiplier).build());
        }
        if (roadCondition != null) {
            context.weather(base.getWeather().toBuilder().roadCondition(roadCondition).build());
        }
        if (fuelPriceFactor != null) {
            context.fuelPrices(base.getFuelPrices().scaled(fuelPriceFactor));
        }
        return context.build();
    }
}
