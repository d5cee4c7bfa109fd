package org.optiroute.routing.model;

/**
 * Energy source of a vehicle. Electric consumption and prices are per kWh, all others per liter.
 */
public enum FuelType {
    DIESEL,
    GASOLINE,
    ELECTRIC,
    HYBRID
}
