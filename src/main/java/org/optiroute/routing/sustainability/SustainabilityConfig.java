package org.optiroute.routing.sustainability;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.routing.model.FuelType;

import java.util.Map;

/**
 * Emission factors, environmental score weights and recommendation thresholds.
 */
@Value
@Builder(toBuilder = true)
public class SustainabilityConfig {
    /** kg CO2 per fuel unit (liter, or kWh for electric). */
    @Singular
    Map<FuelType, Double> emissionFactors;
    @Builder.Default
    double highCo2ThresholdKg = 50.0d;
    @Builder.Default
    double lowFuelEfficiencyThreshold = 10.0d;
    @Builder.Default
    double dieselSwapCo2ThresholdKg = 40.0d;
    /** Score points lost per kg CO2. */
    @Builder.Default
    double co2ScorePenaltyPerKg = 10.0d;
    /** Score points gained per km per fuel unit. */
    @Builder.Default
    double efficiencyScoreFactor = 5.0d;

    /**
     * Returns the default factor table.
     */
    public static SustainabilityConfig defaults() {
        return SustainabilityConfig.builder()
                .emissionFactor(FuelType.DIESEL, 2.68d)
                .emissionFactor(FuelType.GASOLINE, 2.31d)
                .emissionFactor(FuelType.HYBRID, 2.31d)
                .emissionFactor(FuelType.ELECTRIC, 0.40d)
                .build();
    }

    /**
     * kg CO2 per fuel unit for one fuel type.
     *
     * @throws IllegalStateException when the table has no entry for {@code fuelType}.
     */
    public double emissionFactor(FuelType fuelType) {
        Double factor = emissionFactors.get(fuelType);
        if (factor == null) {
            throw new IllegalStateException("no emission factor for " + fuelType);
        }
        return factor;
    }

    /**
     * Validates factors and thresholds.
     */
    public SustainabilityConfig validate() {
        for (FuelType fuelType : FuelType.values()) {
            Double factor = emissionFactors.get(fuelType);
            if (factor == null || !(factor >= 0.0d) || !Double.isFinite(factor)) {
                throw new IllegalArgumentException("emissionFactors[" + fuelType + "] must be finite and >= 0");
            }
        }
        if (!(highCo2ThresholdKg >= 0.0d) || !(lowFuelEfficiencyThreshold >= 0.0d) || !(dieselSwapCo2ThresholdKg >= 0.0d)) {
            throw new IllegalArgumentException("sustainability thresholds must be >= 0");
        }
        if (!(co2ScorePenaltyPerKg >= 0.0d) || !Double.isFinite(co2ScorePenaltyPerKg)
                || !(efficiencyScoreFactor >= 0.0d) || !Double.isFinite(efficiencyScoreFactor)) {
            throw new IllegalArgumentException("environmental score weights must be finite and >= 0");
        }
        return this;
    }
}
