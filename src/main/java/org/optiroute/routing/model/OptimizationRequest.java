package org.optiroute.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Client-facing single-vehicle multi-stop optimization request.
 *
 * <p>Destination order carries no meaning. An empty destination list is valid and yields a
 * result without routes.</p>
 */
@Value
@Builder(toBuilder = true)
public class OptimizationRequest {
    /** Correlation id; generated when blank. */
    String requestId;
    /** Route start. */
    Origin origin;
    /** Stops to serve. */
    @Singular
    List<Destination> destinations;
    /** Vehicle serving every stop. */
    VehicleProfile vehicle;
    /** Hard limits; {@code null} means unbounded. */
    Constraints constraints;
    /** Live signal selection; {@code null} means all signals. */
    RealTimeFactorFlags realTimeFactors;
    /** Planned departure; {@code null} means "now" on the orchestrator clock. */
    Instant departureTime;
    /** Fuel-price region hint; {@code null} means the configured default region. */
    String region;
    /** Caller deadline for the whole call; {@code null} means the configured default. */
    Duration deadline;
    /** When set, the best route must be persisted under this name. */
    String saveAsName;
    /** Owner recorded on the persisted route. */
    String ownerId;
}
