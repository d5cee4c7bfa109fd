package org.optiroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.optiroute.routing.cost.CostBreakdown;
import org.optiroute.routing.scoring.ComparableRoute;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.sustainability.SustainabilityMetrics;

/**
 * Candidate route enriched with its cost and sustainability metrics.
 */
@Value
@Builder(toBuilder = true)
public class RouteOutcome implements ComparableRoute {
    String routeId;
    CandidateRoute candidate;
    CostBreakdown cost;
    SustainabilityMetrics sustainability;

    @Override
    public String routeId() {
        return routeId;
    }

    @Override
    public double rankingCost() {
        return cost.total();
    }

    @Override
    public double rankingDurationHours() {
        return candidate.getTotalDurationMinutes() / 60.0d;
    }

    @Override
    public double rankingCo2Kg() {
        return sustainability.getCo2EmissionsKg();
    }

    @Override
    public double distanceKm() {
        return candidate.getTotalDistanceKm();
    }

    @Override
    public double efficiency() {
        return candidate.getEfficiency();
    }

    @Override
    public double feasibility() {
        return candidate.getFeasibility();
    }

    @Override
    public double environmentalScore() {
        return sustainability.getEnvironmentalScore();
    }

    public double timeSavingsMinutes() {
        return candidate.getTimeSavingsMinutes();
    }
}
