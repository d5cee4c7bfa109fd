package org.optiroute.routing.multimodal;

import org.optiroute.core.geo.GeoPoint;

import java.util.Optional;

/**
 * Lookup of transfer hubs near a point.
 */
public interface HubDirectory {

    /**
     * Returns the nearest hub of {@code kind} to {@code point}, or empty when none serves it.
     */
    Optional<TransportNode> nearest(NodeKind kind, GeoPoint point);
}
