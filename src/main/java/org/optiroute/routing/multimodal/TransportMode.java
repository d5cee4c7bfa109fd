package org.optiroute.routing.multimodal;

/**
 * Physical transport mode of one leg.
 */
public enum TransportMode {
    ROAD,
    SEA,
    AIR,
    RAIL
}
