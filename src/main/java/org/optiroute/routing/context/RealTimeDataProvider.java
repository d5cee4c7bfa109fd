package org.optiroute.routing.context;

import org.optiroute.core.geo.GeoPoint;

import java.util.List;

/**
 * Outbound contract to live traffic, weather and fuel-price feeds.
 *
 * <p>Implementations may block on I/O and may throw any runtime exception; the context provider
 * bounds every call with a timeout and degrades to fallback values.</p>
 */
public interface RealTimeDataProvider {

    /**
     * Returns traffic conditions covering the origin and destinations.
     */
    Traffic getTraffic(GeoPoint origin, List<GeoPoint> destinations);

    /**
     * Returns weather conditions covering the origin and destinations.
     */
    Weather getWeather(GeoPoint origin, List<GeoPoint> destinations);

    /**
     * Returns current fuel prices for a region.
     */
    FuelPrices getFuelPrices(String region);
}
