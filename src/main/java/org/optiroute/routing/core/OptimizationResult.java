package org.optiroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.routing.context.RealTimeContext;

import java.util.List;

/**
 * Result of {@link RouteOptimizationService#optimizeRoutes}.
 */
@Value
@Builder
public class OptimizationResult {
    String requestId;
    /** Selected route; empty when the request had no assignable destination. */
    @Singular
    List<RouteOutcome> routes;
    Summary summary;
    @Singular
    List<OptimizationWarning> warnings;
    RealTimeContext context;
    OptimizationTelemetry telemetry;
    /** Id of the persisted route, or {@code null} when nothing was saved. */
    String savedRouteId;

    public boolean hasWarning(String code) {
        for (OptimizationWarning warning : warnings) {
            if (warning.code().equals(code)) {
                return true;
            }
        }
        return false;
    }
}
