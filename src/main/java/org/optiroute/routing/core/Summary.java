package org.optiroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregate view over all outcomes of a run.
 */
@Value
@Builder
public class Summary {
    int totalDestinations;
    int totalRoutes;
    int assignedDestinations;
    double totalDistanceKm;
    double totalDurationMinutes;
    double totalCost;
    double totalCo2Kg;
    double averageEfficiency;
    @Singular("unassignedDestinationId")
    List<String> unassignedDestinationIds;
    @Singular
    List<String> recommendations;
}
