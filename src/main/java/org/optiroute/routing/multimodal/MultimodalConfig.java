package org.optiroute.routing.multimodal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

/**
 * Immutable rates, speeds and cargo thresholds of the leg planner.
 *
 * <p>Service rates are per chargeable unit and km: trucks for FTL, chargeable tonnes for LTL,
 * containers for FCL, revenue tonnes for LCL, air chargeable tonnes for EXPRESS and ECONOMY.</p>
 */
@Value
@Builder(toBuilder = true)
public class MultimodalConfig {
    @Singular("speedKmh")
    Map<TransportMode, Double> speedsKmh;
    /** Great-circle to network distance factor per mode. */
    @Singular
    Map<TransportMode, Double> circuityFactors;
    /** kg CO2 per tonne-km per mode. */
    @Singular
    Map<TransportMode, Double> emissionFactors;
    /** Terminal handling hours added to every leg of the mode. */
    @Singular
    Map<TransportMode, Double> handlingHours;
    /** Terminal handling charge added to every leg of the mode. */
    @Singular
    Map<TransportMode, Double> handlingCosts;
    @Singular
    Map<ServiceType, Double> serviceRates;
    @Singular
    Map<TransportMode, String> carriers;

    /** Handling factor for templates that keep cargo on the same trailer. */
    @Builder.Default
    double throughTrailerHandlingFactor = 0.5d;
    /** Rail line-haul rate relative to the container service rate. */
    @Builder.Default
    double railRateFactor = 0.8d;

    @Builder.Default
    double ftlWeightThresholdKg = 10_000.0d;
    @Builder.Default
    double ftlVolumeThresholdM3 = 40.0d;
    @Builder.Default
    double fclVolumeThresholdM3 = 15.0d;
    @Builder.Default
    double expressWeightLimitKg = 500.0d;
    @Builder.Default
    double airWeightCeilingKg = 100_000.0d;

    @Builder.Default
    double truckPayloadKg = 24_000.0d;
    @Builder.Default
    double truckVolumeM3 = 86.0d;
    @Builder.Default
    double containerPayloadKg = 26_000.0d;
    @Builder.Default
    double containerVolumeM3 = 67.0d;
    @Builder.Default
    double roadVolumetricKgPerM3 = 333.0d;
    @Builder.Default
    double airVolumetricKgPerM3 = 167.0d;

    /**
     * Returns the default planner configuration.
     */
    public static MultimodalConfig defaults() {
        return MultimodalConfig.builder()
                .speedKmh(TransportMode.ROAD, 60.0d)
                .speedKmh(TransportMode.SEA, 30.0d)
                .speedKmh(TransportMode.AIR, 750.0d)
                .speedKmh(TransportMode.RAIL, 50.0d)
                .circuityFactor(TransportMode.ROAD, 1.2d)
                .circuityFactor(TransportMode.SEA, 1.3d)
                .circuityFactor(TransportMode.AIR, 1.05d)
                .circuityFactor(TransportMode.RAIL, 1.25d)
                .emissionFactor(TransportMode.ROAD, 0.062d)
                .emissionFactor(TransportMode.SEA, 0.008d)
                .emissionFactor(TransportMode.AIR, 0.602d)
                .emissionFactor(TransportMode.RAIL, 0.022d)
                .handlingHour(TransportMode.ROAD, 0.0d)
                .handlingHour(TransportMode.SEA, 48.0d)
                .handlingHour(TransportMode.AIR, 12.0d)
                .handlingHour(TransportMode.RAIL, 24.0d)
                .handlingCost(TransportMode.ROAD, 0.0d)
                .handlingCost(TransportMode.SEA, 450.0d)
                .handlingCost(TransportMode.AIR, 250.0d)
                .handlingCost(TransportMode.RAIL, 300.0d)
                .serviceRate(ServiceType.FTL, 1.5d)
                .serviceRate(ServiceType.LTL, 0.18d)
                .serviceRate(ServiceType.FCL, 0.35d)
                .serviceRate(ServiceType.LCL, 0.06d)
                .serviceRate(ServiceType.EXPRESS, 4.5d)
                .serviceRate(ServiceType.ECONOMY, 2.8d)
                .carrier(TransportMode.ROAD, "road-haulier")
                .carrier(TransportMode.SEA, "ocean-carrier")
                .carrier(TransportMode.AIR, "air-carrier")
                .carrier(TransportMode.RAIL, "rail-operator")
                .build();
    }

    public double speedKmh(TransportMode mode) {
        return required(speedsKmh, mode, "speedsKmh");
    }

    public double circuityFactor(TransportMode mode) {
        return required(circuityFactors, mode, "circuityFactors");
    }

    public double emissionFactor(TransportMode mode) {
        return required(emissionFactors, mode, "emissionFactors");
    }

    public double handlingHours(TransportMode mode) {
        return handlingHours.getOrDefault(mode, 0.0d);
    }

    public double handlingCost(TransportMode mode) {
        return handlingCosts.getOrDefault(mode, 0.0d);
    }

    public double serviceRate(ServiceType serviceType) {
        return required(serviceRates, serviceType, "serviceRates");
    }

    public String carrier(TransportMode mode) {
        return carriers.getOrDefault(mode, mode.name().toLowerCase(Locale.ROOT));
    }

    /**
     * Validates completeness and ranges.
     *
     * @throws IllegalArgumentException on a missing or out-of-range entry.
     */
    public MultimodalConfig validate() {
        for (TransportMode mode : TransportMode.values()) {
            if (!(speedKmh(mode) > 0.0d)) {
                throw new IllegalArgumentException("speedsKmh[" + mode + "] must be > 0");
            }
            if (!(circuityFactor(mode) >= 1.0d)) {
                throw new IllegalArgumentException("circuityFactors[" + mode + "] must be >= 1");
            }
            if (!(emissionFactor(mode) >= 0.0d)) {
                throw new IllegalArgumentException("emissionFactors[" + mode + "] must be >= 0");
            }
        }
        for (ServiceType serviceType : ServiceType.values()) {
            if (!(serviceRate(serviceType) >= 0.0d)) {
                throw new IllegalArgumentException("serviceRates[" + serviceType + "] must be >= 0");
            }
        }
        if (!(truckPayloadKg > 0.0d && truckVolumeM3 > 0.0d && containerPayloadKg > 0.0d && containerVolumeM3 > 0.0d)) {
            throw new IllegalArgumentException("truck and container capacities must be > 0");
        }
        return this;
    }

    private static <K> double required(Map<K, Double> values, K key, String fieldName) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " has no entry for " + key);
        }
        return value;
    }
}
