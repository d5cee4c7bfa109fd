package org.optiroute.routing.cost;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.routing.model.FuelType;

import java.util.Map;

/**
 * Immutable rates of the route cost model.
 *
 * <p>Currency units are those of the fuel-price feed.</p>
 */
@Value
@Builder(toBuilder = true)
public class CostModelConfig {
    public static final double DEFAULT_DRIVER_HOURLY_RATE = 50.0d;
    public static final double DEFAULT_VEHICLE_RATE_PER_KM = 2.0d;
    public static final double DEFAULT_TOLL_RATE_PER_KM = 0.1d;
    public static final double DEFAULT_LATE_PENALTY_PER_MINUTE = 2.0d;
    public static final double DEFAULT_LATE_PENALTY_PER_VIOLATION = 100.0d;
    public static final double DEFAULT_BASELINE_MULTIPLIER = 1.2d;

    /** Fuel units per km by fuel type (liters, or kWh for electric). */
    @Singular
    Map<FuelType, Double> consumptionRates;
    @Builder.Default
    double driverHourlyRate = DEFAULT_DRIVER_HOURLY_RATE;
    @Builder.Default
    double vehicleRatePerKm = DEFAULT_VEHICLE_RATE_PER_KM;
    @Builder.Default
    double tollRatePerKm = DEFAULT_TOLL_RATE_PER_KM;
    @Builder.Default
    double latePenaltyPerMinute = DEFAULT_LATE_PENALTY_PER_MINUTE;
    @Builder.Default
    double latePenaltyPerViolation = DEFAULT_LATE_PENALTY_PER_VIOLATION;
    /** Unoptimized-route cost as a multiple of the optimized cost; must be {@code >= 1}. */
    @Builder.Default
    double baselineMultiplier = DEFAULT_BASELINE_MULTIPLIER;

    /**
     * Returns the default rate table.
     */
    public static CostModelConfig defaults() {
        return CostModelConfig.builder()
                .consumptionRate(FuelType.DIESEL, 0.08d)
                .consumptionRate(FuelType.GASOLINE, 0.09d)
                .consumptionRate(FuelType.HYBRID, 0.05d)
                .consumptionRate(FuelType.ELECTRIC, 0.20d)
                .build();
    }

    /**
     * Fuel units per km for one fuel type.
     *
     * @throws IllegalStateException when the table has no entry for {@code fuelType}.
     */
    public double consumptionPerKm(FuelType fuelType) {
        Double rate = consumptionRates.get(fuelType);
        if (rate == null) {
            throw new IllegalStateException("no consumption rate for " + fuelType);
        }
        return rate;
    }

    /**
     * Validates rates.
     *
     * @throws IllegalArgumentException when a rate is negative or non-finite, a fuel type has no
     *                                  consumption rate, or the baseline multiplier is below 1.
     */
    public CostModelConfig validate() {
        for (FuelType fuelType : FuelType.values()) {
            Double rate = consumptionRates.get(fuelType);
            if (rate == null || !(rate >= 0.0d) || !Double.isFinite(rate)) {
                throw new IllegalArgumentException("consumptionRates[" + fuelType + "] must be finite and >= 0");
            }
        }
        requireNonNegative(driverHourlyRate, "driverHourlyRate");
        requireNonNegative(vehicleRatePerKm, "vehicleRatePerKm");
        requireNonNegative(tollRatePerKm, "tollRatePerKm");
        requireNonNegative(latePenaltyPerMinute, "latePenaltyPerMinute");
        requireNonNegative(latePenaltyPerViolation, "latePenaltyPerViolation");
        if (!(baselineMultiplier >= 1.0d) || !Double.isFinite(baselineMultiplier)) {
            throw new IllegalArgumentException("baselineMultiplier must be finite and >= 1, got " + baselineMultiplier);
        }
        return this;
    }

    private static void requireNonNegative(double value, String fieldName) {
        if (!(value >= 0.0d) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite and >= 0, got " + value);
        }
    }
}
