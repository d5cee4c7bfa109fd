package org.optiroute.routing.context;

import lombok.experimental.UtilityClass;
import org.optiroute.routing.model.FuelType;

/**
 * Named fallback values used when a live source is disabled or unavailable.
 */
@UtilityClass
public class ContextDefaults {
    public static final String DEFAULT_REGION = "default";

    public static final double DEFAULT_CONGESTION_LEVEL = 0.3d;
    public static final double DEFAULT_AVERAGE_SPEED_KMH = 45.0d;

    public static final double DEFAULT_TEMPERATURE_C = 20.0d;
    public static final double DEFAULT_HUMIDITY_PERCENT = 60.0d;
    public static final double DEFAULT_WIND_SPEED_KMH = 15.0d;
    public static final double DEFAULT_PRECIPITATION_MM_PER_HOUR = 0.0d;
    public static final double DEFAULT_VISIBILITY_KM = 10.0d;
    public static final RoadCondition DEFAULT_ROAD_CONDITION = RoadCondition.DRY;

    public static final double DEFAULT_DIESEL_PRICE = 22.50d;
    public static final double DEFAULT_GASOLINE_PRICE = 24.30d;
    public static final double DEFAULT_ELECTRIC_PRICE = 1.80d;
    public static final double DEFAULT_HYBRID_PRICE = DEFAULT_GASOLINE_PRICE;

    /**
     * Default traffic snapshot.
     */
    public static Traffic traffic() {
        return Traffic.builder()
                .congestionLevel(DEFAULT_CONGESTION_LEVEL)
                .averageSpeedKmh(DEFAULT_AVERAGE_SPEED_KMH)
                .build();
    }

    /**
     * Default weather snapshot.
     */
    public static Weather weather() {
        return Weather.builder()
                .temperatureC(DEFAULT_TEMPERATURE_C)
                .humidityPercent(DEFAULT_HUMIDITY_PERCENT)
                .windSpeedKmh(DEFAULT_WIND_SPEED_KMH)
                .precipitationMmPerHour(DEFAULT_PRECIPITATION_MM_PER_HOUR)
                .visibilityKm(DEFAULT_VISIBILITY_KM)
                .roadCondition(DEFAULT_ROAD_CONDITION)
                .build();
    }

    /**
     * Default fuel price table for a region.
     */
    public static FuelPrices fuelPrices(String region) {
        return FuelPrices.builder()
                .region(region == null ? DEFAULT_REGION : region)
                .price(FuelType.DIESEL, DEFAULT_DIESEL_PRICE)
                .price(FuelType.GASOLINE, DEFAULT_GASOLINE_PRICE)
                .price(FuelType.ELECTRIC, DEFAULT_ELECTRIC_PRICE)
                .price(FuelType.HYBRID, DEFAULT_HYBRID_PRICE)
                .build();
    }
}
