package org.optiroute.routing.multimodal;

import org.optiroute.core.geo.GeoDistance;
import org.optiroute.core.geo.GeoPoint;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable nearest-hub directory over a fixed hub list.
 *
 * <p>Hubs farther than the service radius are not returned. Ties resolve to the hub listed
 * first.</p>
 */
public final class StaticHubDirectory implements HubDirectory {
    public static final double DEFAULT_SERVICE_RADIUS_KM = 1_500.0d;

    private final List<TransportNode> hubs;
    private final double serviceRadiusKm;

    public StaticHubDirectory(Collection<TransportNode> hubs) {
        this(hubs, DEFAULT_SERVICE_RADIUS_KM);
    }

    public StaticHubDirectory(Collection<TransportNode> hubs, double serviceRadiusKm) {
        this.hubs = List.copyOf(Objects.requireNonNull(hubs, "hubs"));
        if (!(serviceRadiusKm > 0.0d)) {
            throw new IllegalArgumentException("serviceRadiusKm must be > 0");
        }
        for (TransportNode hub : this.hubs) {
            if (hub.kind() == NodeKind.ADDRESS) {
                throw new IllegalArgumentException("hub " + hub.id() + " must not be an ADDRESS node");
            }
        }
        this.serviceRadiusKm = serviceRadiusKm;
    }

    @Override
    public Optional<TransportNode> nearest(NodeKind kind, GeoPoint point) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(point, "point");
        TransportNode best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (TransportNode hub : hubs) {
            if (hub.kind() != kind) {
                continue;
            }
            double distance = GeoDistance.greatCircleDistanceKm(point, hub.location());
            if (distance <= serviceRadiusKm && distance < bestDistance) {
                best = hub;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the configured hubs.
     */
    public List<TransportNode> hubs() {
        return hubs;
    }
}
