package org.optiroute.routing.recommendation;

import lombok.Builder;
import lombok.Value;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.solver.CandidateRoute;

/**
 * Facts the rule table is evaluated against.
 */
@Value
@Builder
public class RecommendationInput {
    RealTimeContext context;
    FuelType fuelType;
    /** Selected candidate; {@code null} when no route was built. */
    CandidateRoute selected;
    double feasibilityThreshold;
}
