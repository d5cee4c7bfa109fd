package org.optiroute.routing.solver;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Open route produced by exactly one solver.
 *
 * <p>Routes built by {@link RouteEvaluator} order stops by non-decreasing arrival and carry a
 * total distance equal to the sum of stop distances.</p>
 */
@Value
@Builder(toBuilder = true)
public class CandidateRoute {
    SolverAlgorithm algorithm;
    Instant departureTime;
    @Singular
    List<Stop> stops;
    double totalDistanceKm;
    /** Minutes from departure to the last stop's departure. */
    double totalDurationMinutes;
    /** Admissible lower bound over actual distance, in {@code [0, 1]}. */
    double efficiency;
    /** On-time stops over all requested stops, in {@code [0, 1]}. */
    double feasibility;
    /** Minutes saved against visiting the same stops in request order. */
    double timeSavingsMinutes;
    @Singular("unassignedDestinationId")
    List<String> unassignedDestinationIds;

    /**
     * Sum of lateness over all stops.
     */
    public double totalLatenessMinutes() {
        double total = 0.0d;
        for (Stop stop : stops) {
            total += stop.getLatenessMinutes();
        }
        return total;
    }

    /**
     * Number of stops reached after their window closed.
     */
    public int lateStopCount() {
        int count = 0;
        for (Stop stop : stops) {
            if (stop.isLate()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Total delivered weight.
     */
    public double totalWeightKg() {
        double total = 0.0d;
        for (Stop stop : stops) {
            total += stop.getWeightKg();
        }
        return total;
    }

    /**
     * Total delivered volume.
     */
    public double totalVolumeM3() {
        double total = 0.0d;
        for (Stop stop : stops) {
            total += stop.getVolumeM3();
        }
        return total;
    }
}
