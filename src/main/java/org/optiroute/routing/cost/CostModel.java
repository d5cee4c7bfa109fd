package org.optiroute.routing.cost;

import org.optiroute.core.time.TimeUtils;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.Stop;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes route costs from a candidate, a context snapshot and a vehicle.
 *
 * <pre>
 * fuel    = consumption * fuelPrice(fuelType)
 * driver  = driverHourlyRate * hours
 * vehicle = vehicleRatePerKm * distance
 * toll    = tollRatePerKm * distance        (0 when tolls are avoided)
 * penalty = lateMinutes * perMinute + lateStops * perViolation
 * savings = total * baselineMultiplier - total
 * </pre>
 */
public final class CostModel {
    private final CostModelConfig config;
    private final FuelConsumptionModel fuelConsumptionModel;

    public CostModel(CostModelConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.fuelConsumptionModel = new FuelConsumptionModel(config);
    }

    /**
     * Computes costs with no toll avoidance.
     */
    public CostBreakdown computeCost(CandidateRoute route, RealTimeContext context, VehicleProfile vehicle) {
        return computeCost(route, context, vehicle, null);
    }

    /**
     * Computes costs for one route.
     *
     * @param route candidate route.
     * @param context context snapshot used to build the route.
     * @param vehicle vehicle driving the route.
     * @param constraints request constraints (nullable); {@code avoidTolls} zeroes toll cost.
     * @return cost breakdown whose total equals the sum of its components.
     */
    public CostBreakdown computeCost(
            CandidateRoute route,
            RealTimeContext context,
            VehicleProfile vehicle,
            Constraints constraints
    ) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(vehicle, "vehicle");
        boolean avoidTolls = constraints != null && constraints.isAvoidTolls();

        double distance = route.getTotalDistanceKm();
        double consumption = fuelConsumptionModel.consumption(distance, vehicle.getFuelType(), context);
        double fuelCost = consumption * context.getFuelPrices().price(vehicle.getFuelType());
        double driverCost = config.getDriverHourlyRate() * TimeUtils.minutesToHours(route.getTotalDurationMinutes());
        double vehicleCost = config.getVehicleRatePerKm() * distance;
        double tollCost = avoidTolls ? 0.0d : config.getTollRatePerKm() * distance;
        double penaltyCost = config.getLatePenaltyPerMinute() * route.totalLatenessMinutes()
                + config.getLatePenaltyPerViolation() * route.lateStopCount();

        double total = fuelCost + driverCost + vehicleCost + tollCost + penaltyCost;
        double savings = Math.max(0.0d, total * config.getBaselineMultiplier() - total);
        return new CostBreakdown(fuelCost, driverCost, vehicleCost, tollCost, penaltyCost, consumption, savings);
    }

    /**
     * Returns a copy of the route whose stops carry their share of the route cost.
     *
     * <p>A stop is charged the distance-driven costs of its inbound leg, the driver time since
     * the previous departure and its own lateness penalty, so stop costs sum to the route total.</p>
     */
    public CandidateRoute attributeStopCosts(
            CandidateRoute route,
            RealTimeContext context,
            VehicleProfile vehicle,
            Constraints constraints
    ) {
        Objects.requireNonNull(route, "route");
        boolean avoidTolls = constraints != null && constraints.isAvoidTolls();
        double fuelPrice = context.getFuelPrices().price(vehicle.getFuelType());
        double perKm = config.getVehicleRatePerKm() + (avoidTolls ? 0.0d : config.getTollRatePerKm());

        List<Stop> costed = new ArrayList<>(route.getStops().size());
        Instant previousDeparture = route.getDepartureTime();
        for (Stop stop : route.getStops()) {
            double leg = stop.getDistanceFromPreviousKm();
            double fuel = fuelConsumptionModel.consumption(leg, vehicle.getFuelType(), context) * fuelPrice;
            double driver = config.getDriverHourlyRate()
                    * TimeUtils.minutesToHours(TimeUtils.minutesBetween(previousDeparture, stop.getDepartureTime()));
            double penalty = stop.isLate()
                    ? config.getLatePenaltyPerMinute() * stop.getLatenessMinutes() + config.getLatePenaltyPerViolation()
                    : 0.0d;
            costed.add(stop.toBuilder().incrementalCost(fuel + driver + perKm * leg + penalty).build());
            previousDeparture = stop.getDepartureTime();
        }
        return route.toBuilder().clearStops().stops(costed).build();
    }

    public CostModelConfig config() {
        return config;
    }

    public FuelConsumptionModel fuelConsumptionModel() {
        return fuelConsumptionModel;
    }
}
