package org.optiroute.routing.event;

import lombok.Builder;
import lombok.Value;

/**
 * Payload of {@link #NAME}, published once per successful optimization.
 */
@Value
@Builder
public class OptimizationCompletedEvent {
    public static final String NAME = "route.optimization.completed";

    String requestId;
    int totalDestinations;
    int totalRoutes;
    double totalCost;
    double averageEfficiency;
}
