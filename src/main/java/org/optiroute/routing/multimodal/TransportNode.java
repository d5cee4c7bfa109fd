package org.optiroute.routing.multimodal;

import org.optiroute.core.geo.GeoPoint;

import java.util.Objects;

/**
 * Shipment origin, destination or transfer hub.
 *
 * @param id stable node id; equal ids denote the same node.
 * @param name display name.
 * @param location coordinates.
 * @param kind node role.
 */
public record TransportNode(String id, String name, GeoPoint location, NodeKind kind) {
    public TransportNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(kind, "kind");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must be non-blank");
        }
    }

    /**
     * Creates an address node for a shipment endpoint.
     */
    public static TransportNode address(String id, GeoPoint location) {
        return new TransportNode(id, id, location, NodeKind.ADDRESS);
    }
}
