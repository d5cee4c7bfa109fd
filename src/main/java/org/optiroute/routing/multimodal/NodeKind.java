package org.optiroute.routing.multimodal;

/**
 * Role of a transport node.
 */
public enum NodeKind {
    ADDRESS,
    SEAPORT,
    AIRPORT,
    RAIL_TERMINAL,
    /** Transshipment hub handling both sea and air cargo. */
    SEA_AIR_HUB
}
