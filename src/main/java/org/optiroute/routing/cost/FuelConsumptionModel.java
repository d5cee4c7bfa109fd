package org.optiroute.routing.cost;

import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RoadCondition;
import org.optiroute.routing.model.FuelType;

import java.util.Objects;

/**
 * Fuel consumption shared by the cost and sustainability models.
 *
 * <pre>
 * consumption = distance * consumptionPerKm(fuelType) * trafficMultiplier * roadFuelMultiplier
 * </pre>
 */
public final class FuelConsumptionModel {
    private final CostModelConfig config;

    public FuelConsumptionModel(CostModelConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Fuel units used over {@code distanceKm} under {@code context}.
     */
    public double consumption(double distanceKm, FuelType fuelType, RealTimeContext context) {
        Objects.requireNonNull(fuelType, "fuelType");
        Objects.requireNonNull(context, "context");
        return distanceKm
                * config.consumptionPerKm(fuelType)
                * trafficMultiplier(context)
                * roadMultiplier(context);
    }

    private static double trafficMultiplier(RealTimeContext context) {
        if (context.getTimeFactors() == null) {
            return 1.0d;
        }
        return context.getTimeFactors().getTrafficMultiplier();
    }

    private static double roadMultiplier(RealTimeContext context) {
        if (context.getWeather() == null || context.getWeather().getRoadCondition() == null) {
            return RoadCondition.DRY.fuelMultiplier();
        }
        return context.getWeather().getRoadCondition().fuelMultiplier();
    }
}
