package org.optiroute.routing.multimodal;

/**
 * Commercial service booked for one leg.
 */
public enum ServiceType {
    /** Full truckload. */
    FTL,
    /** Less-than-truckload. */
    LTL,
    /** Full container load. */
    FCL,
    /** Less-than-container load. */
    LCL,
    EXPRESS,
    ECONOMY
}
