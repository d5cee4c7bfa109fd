package org.optiroute.routing.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Route persisted under a name for later reuse.
 *
 * <p>Instances are immutable; stores replace them on every change.</p>
 */
@Value
@Builder(toBuilder = true)
public class SavedRoute {
    String id;
    String name;
    String description;
    /** JSON document written by {@link SavedRoutePayloadCodec}. */
    String payload;
    String ownerId;
    long usageCount;
    Instant createdAt;
    /** {@code null} until the route is first reused. */
    Instant lastUsedAt;
}
