package org.optiroute.routing.store;

import org.optiroute.routing.cost.CostBreakdown;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.Stop;
import org.optiroute.routing.sustainability.SustainabilityMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializable snapshot of an optimized route.
 */
public record SavedRoutePayload(
        String algorithm,
        Instant departureTime,
        double totalDistanceKm,
        double totalDurationMinutes,
        double efficiency,
        double feasibility,
        double totalCost,
        double co2EmissionsKg,
        List<StopPayload> stops,
        List<String> unassignedDestinationIds
) {
    public SavedRoutePayload {
        stops = stops == null ? List.of() : List.copyOf(stops);
        unassignedDestinationIds = unassignedDestinationIds == null ? List.of() : List.copyOf(unassignedDestinationIds);
    }

    /**
     * One visited stop.
     */
    public record StopPayload(
            String destinationId,
            double latitude,
            double longitude,
            Instant arrivalTime,
            Instant departureTime,
            double distanceFromPreviousKm,
            double incrementalCost
    ) {
    }

    /**
     * Captures a costed route.
     */
    public static SavedRoutePayload from(
            CandidateRoute route,
            CostBreakdown cost,
            SustainabilityMetrics sustainability
    ) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(cost, "cost");
        Objects.requireNonNull(sustainability, "sustainability");
        List<StopPayload> stops = new ArrayList<>(route.getStops().size());
        for (Stop stop : route.getStops()) {
            stops.add(new StopPayload(
                    stop.getDestinationId(),
                    stop.getLocation().latitude(),
                    stop.getLocation().longitude(),
                    stop.getArrivalTime(),
                    stop.getDepartureTime(),
                    stop.getDistanceFromPreviousKm(),
                    stop.getIncrementalCost()
            ));
        }
        return new SavedRoutePayload(
                route.getAlgorithm().id(),
                route.getDepartureTime(),
                route.getTotalDistanceKm(),
                route.getTotalDurationMinutes(),
                route.getEfficiency(),
                route.getFeasibility(),
                cost.total(),
                sustainability.getCo2EmissionsKg(),
                stops,
                route.getUnassignedDestinationIds()
        );
    }
}
