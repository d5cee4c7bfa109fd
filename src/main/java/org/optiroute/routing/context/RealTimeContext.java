package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable context snapshot shared by every solver and model of one optimization run.
 *
 * <p>{@code stale=true} means at least one source was served from last-known-good or default
 * values; {@link #getDegradedSources()} lists which.</p>
 */
@Value
@Builder(toBuilder = true)
public class RealTimeContext {
    Traffic traffic;
    Weather weather;
    FuelPrices fuelPrices;
    TimeFactors timeFactors;
    /** Instant the snapshot describes. */
    Instant capturedAt;
    boolean stale;
    @Singular
    Set<ContextSource> degradedSources;
}
