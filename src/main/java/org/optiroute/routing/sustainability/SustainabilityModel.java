package org.optiroute.routing.sustainability;

import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.cost.FuelConsumptionModel;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.solver.CandidateRoute;

import java.util.Objects;

/**
 * Computes CO2, fuel efficiency and an environmental score for a route.
 *
 * <pre>
 * co2        = consumption * emissionFactor(fuelType)
 * efficiency = distance / consumption
 * score      = (clamp(100 - co2 * co2ScorePenaltyPerKg) + clamp(efficiency * efficiencyScoreFactor)) / 2
 * </pre>
 *
 * <p>Both partial scores are clamped to {@code [0, 100]}.</p>
 */
public final class SustainabilityModel {
    public static final String RECOMMEND_ELECTRIFIED_FLEET =
            "High CO2 emissions: evaluate an electric or hybrid vehicle for this route";
    public static final String RECOMMEND_MAINTENANCE =
            "Low fuel efficiency: schedule vehicle maintenance";
    public static final String RECOMMEND_REPLACE_DIESEL =
            "Replace the diesel vehicle with a hybrid or electric one";

    private static final double MAX_SCORE = 100.0d;

    private final SustainabilityConfig config;
    private final FuelConsumptionModel fuelConsumptionModel;

    public SustainabilityModel(SustainabilityConfig config, FuelConsumptionModel fuelConsumptionModel) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.fuelConsumptionModel = Objects.requireNonNull(fuelConsumptionModel, "fuelConsumptionModel");
    }

    /**
     * Computes sustainability metrics for one route.
     */
    public SustainabilityMetrics computeSustainability(
            CandidateRoute route,
            RealTimeContext context,
            VehicleProfile vehicle
    ) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(vehicle, "vehicle");
        FuelType fuelType = vehicle.getFuelType();
        double distance = route.getTotalDistanceKm();
        double consumption = fuelConsumptionModel.consumption(distance, fuelType, context);
        double co2 = consumption * config.emissionFactor(fuelType);
        double efficiency = consumption > 0.0d ? distance / consumption : 0.0d;

        double co2Score = score(MAX_SCORE - co2 * config.getCo2ScorePenaltyPerKg());
        double efficiencyScore = score(efficiency * config.getEfficiencyScoreFactor());

        SustainabilityMetrics.SustainabilityMetricsBuilder metrics = SustainabilityMetrics.builder()
                .co2EmissionsKg(co2)
                .fuelEfficiency(efficiency)
                .environmentalScore((co2Score + efficiencyScore) / 2.0d);
        if (co2 > config.getHighCo2ThresholdKg()) {
            metrics.recommendation(RECOMMEND_ELECTRIFIED_FLEET);
        }
        if (consumption > 0.0d && efficiency < config.getLowFuelEfficiencyThreshold()) {
            metrics.recommendation(RECOMMEND_MAINTENANCE);
        }
        if (fuelType == FuelType.DIESEL && co2 > config.getDieselSwapCo2ThresholdKg()) {
            metrics.recommendation(RECOMMEND_REPLACE_DIESEL);
        }
        return metrics.build();
    }

    private static double score(double raw) {
        return Math.max(0.0d, Math.min(MAX_SCORE, raw));
    }
}
