package org.optiroute.core.geo;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Numeric helpers for great-circle distance computations.
 */
@UtilityClass
public class GeoDistance {
    private static final double EARTH_MEAN_RADIUS_KM = 6_371.0088d;

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    public static double greatCircleDistanceKm(GeoPoint from, GeoPoint to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return greatCircleDistanceKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    public static double greatCircleDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    /**
     * Returns the midpoint of two points on a flat lat/lon projection.
     *
     * <p>Good enough for hub selection heuristics; not a geodesic midpoint.</p>
     */
    public static GeoPoint planarMidpoint(GeoPoint a, GeoPoint b) {
        double longitude = a.longitude() + normalizeDeltaLongitudeDegrees(b.longitude() - a.longitude()) * 0.5d;
        if (longitude > 180.0d) {
            longitude -= 360.0d;
        } else if (longitude < -180.0d) {
            longitude += 360.0d;
        }
        return new GeoPoint((a.latitude() + b.latitude()) * 0.5d, longitude);
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    public static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
