package org.optiroute.core.geo;

/**
 * Immutable WGS84 coordinate pair in decimal degrees.
 *
 * @param latitude latitude in {@code [-90, 90]}.
 * @param longitude longitude in {@code [-180, 180]}.
 */
public record GeoPoint(double latitude, double longitude) {

    /**
     * Creates a coordinate pair.
     */
    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Returns true when both components are finite and inside WGS84 bounds.
     */
    public boolean isValid() {
        return Double.isFinite(latitude)
                && Double.isFinite(longitude)
                && latitude >= -90.0d
                && latitude <= 90.0d
                && longitude >= -180.0d
                && longitude <= 180.0d;
    }

    /**
     * Great-circle distance to another point in kilometers.
     */
    public double distanceKmTo(GeoPoint other) {
        return GeoDistance.greatCircleDistanceKm(this, other);
    }
}
