package org.optiroute.routing.context;

/**
 * Independently fetched parts of a context snapshot.
 */
public enum ContextSource {
    TRAFFIC,
    WEATHER,
    FUEL_PRICES
}
