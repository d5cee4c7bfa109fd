package org.optiroute.routing.core;

import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.multimodal.CargoProfile;
import org.optiroute.routing.multimodal.MultimodalRoute;
import org.optiroute.routing.scoring.ComparisonCriterion;
import org.optiroute.routing.scoring.ComparisonResult;
import org.optiroute.routing.scoring.ScoringWeights;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.SolverAlgorithm;
import org.optiroute.routing.store.SavedRoute;
import org.optiroute.routing.validation.Scenario;
import org.optiroute.routing.validation.SimulationResult;
import org.optiroute.routing.validation.ValidationResult;

import java.util.List;

/**
 * Public route optimization contract.
 *
 * <p>Implementations validate input before doing any work and throw {@link OptimizationException}
 * with stable reason codes for contract failures.</p>
 */
public interface RouteOptimizationService {

    /**
     * Optimizes one single-vehicle multi-stop request.
     *
     * @param request client request.
     * @return selected route with cost, sustainability, summary and warnings.
     */
    OptimizationResult optimizeRoutes(OptimizationRequest request);

    /**
     * Plans point-to-point multimodal routes, best first.
     */
    List<MultimodalRoute> planMultimodalRoutes(
            GeoPoint origin,
            GeoPoint destination,
            CargoProfile cargo,
            ScoringWeights weights
    );

    ValidationResult validateRoute(CandidateRoute route, Constraints constraints);

    ValidationResult validateRoute(CandidateRoute route, Constraints constraints, VehicleProfile vehicle);

    /**
     * Simulates a route against a neutral base context and the reference vehicle.
     */
    SimulationResult simulateRoute(CandidateRoute route, List<Scenario> scenarios);

    SimulationResult simulateRoute(
            CandidateRoute route,
            List<Scenario> scenarios,
            RealTimeContext baseContext,
            VehicleProfile vehicle,
            Constraints constraints
    );

    ComparisonResult compareRoutes(List<RouteOutcome> routes, List<ComparisonCriterion> criteria);

    /**
     * Collects a real-time context snapshot for the current instant.
     */
    RealTimeContext currentContext(GeoPoint origin, List<GeoPoint> destinations, String region);

    SavedRoute saveRoute(RouteOutcome outcome, String name, String description, String ownerId);

    List<SavedRoute> savedRoutes(String search, String ownerId);

    boolean deleteSavedRoute(String savedRouteId);

    SavedRoute reassignSavedRoute(String savedRouteId, String newOwnerId);

    List<SolverAlgorithm> availableAlgorithms();

    List<ConstraintDescriptor> availableConstraints();
}
