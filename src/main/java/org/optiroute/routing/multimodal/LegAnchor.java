package org.optiroute.routing.multimodal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Symbolic leg endpoint resolved per shipment.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum LegAnchor {
    ORIGIN(NodeKind.ADDRESS, Side.ORIGIN),
    DESTINATION(NodeKind.ADDRESS, Side.DESTINATION),
    ORIGIN_SEAPORT(NodeKind.SEAPORT, Side.ORIGIN),
    DESTINATION_SEAPORT(NodeKind.SEAPORT, Side.DESTINATION),
    ORIGIN_AIRPORT(NodeKind.AIRPORT, Side.ORIGIN),
    DESTINATION_AIRPORT(NodeKind.AIRPORT, Side.DESTINATION),
    ORIGIN_RAIL_TERMINAL(NodeKind.RAIL_TERMINAL, Side.ORIGIN),
    DESTINATION_RAIL_TERMINAL(NodeKind.RAIL_TERMINAL, Side.DESTINATION),
    /** Sea/air hub nearest the shipment midpoint. */
    TRANSSHIPMENT_HUB(NodeKind.SEA_AIR_HUB, Side.MIDPOINT);

    /**
     * Point a hub anchor is looked up from.
     */
    public enum Side {
        ORIGIN,
        DESTINATION,
        MIDPOINT
    }

    private final NodeKind kind;
    private final Side side;
}
