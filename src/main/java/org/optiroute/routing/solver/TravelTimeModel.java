package org.optiroute.routing.solver;

import org.optiroute.core.time.TimeUtils;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RoadCondition;

/**
 * Effective road speed derived from one context snapshot.
 *
 * <p>{@code speed = averageSpeed / trafficMultiplier * roadSpeedFactor * highwayFactor}.</p>
 */
public final class TravelTimeModel {
    private final double effectiveSpeedKmh;

    private TravelTimeModel(double effectiveSpeedKmh) {
        if (!(effectiveSpeedKmh > 0.0d) || !Double.isFinite(effectiveSpeedKmh)) {
            throw new IllegalArgumentException("effective speed must be positive and finite, got " + effectiveSpeedKmh);
        }
        this.effectiveSpeedKmh = effectiveSpeedKmh;
    }

    /**
     * Creates a model with a fixed effective speed.
     */
    public static TravelTimeModel ofSpeed(double effectiveSpeedKmh) {
        return new TravelTimeModel(effectiveSpeedKmh);
    }

    /**
     * Derives the effective speed from a context snapshot.
     *
     * @param context context snapshot.
     * @param avoidHighways whether highways are avoided.
     * @param highwayAvoidanceSpeedFactor speed factor used when {@code avoidHighways}.
     */
    public static TravelTimeModel from(RealTimeContext context, boolean avoidHighways, double highwayAvoidanceSpeedFactor) {
        double averageSpeed = context.getTraffic().getAverageSpeedKmh();
        if (!(averageSpeed > 0.0d)) {
            averageSpeed = ContextDefaults.DEFAULT_AVERAGE_SPEED_KMH;
        }
        double trafficMultiplier = context.getTimeFactors().getTrafficMultiplier();
        if (!(trafficMultiplier > 0.0d)) {
            trafficMultiplier = 1.0d;
        }
        RoadCondition roadCondition = context.getWeather().getRoadCondition() == null
                ? RoadCondition.DRY
                : context.getWeather().getRoadCondition();
        double speed = averageSpeed / trafficMultiplier * roadCondition.speedFactor();
        if (avoidHighways) {
            speed *= highwayAvoidanceSpeedFactor;
        }
        return new TravelTimeModel(speed);
    }

    /**
     * Travel time for a road distance.
     */
    public double travelMinutes(double distanceKm) {
        return TimeUtils.travelMinutes(distanceKm, effectiveSpeedKmh);
    }

    public double effectiveSpeedKmh() {
        return effectiveSpeedKmh;
    }
}
