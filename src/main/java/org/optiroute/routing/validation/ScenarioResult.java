package org.optiroute.routing.validation;

import lombok.Builder;
import lombok.Value;
import org.optiroute.routing.cost.CostBreakdown;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.sustainability.SustainabilityMetrics;

/**
 * Route re-timed and re-costed under one scenario.
 */
@Value
@Builder
public class ScenarioResult {
    String scenarioName;
    double probability;
    CandidateRoute route;
    CostBreakdown cost;
    SustainabilityMetrics sustainability;
    ValidationResult validation;
    /** {@code 1 - validation.feasibilityScore}. */
    double risk;

    public double durationMinutes() {
        return route.getTotalDurationMinutes();
    }

    public double totalCost() {
        return cost.total();
    }

    public boolean breachesConstraints() {
        return !validation.isValid();
    }
}
