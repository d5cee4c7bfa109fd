package org.optiroute.routing.solver;

/**
 * Route-construction strategy contract.
 *
 * <p>Implementations must be stateless and thread-safe; one instance serves concurrent runs.</p>
 */
public interface RouteSolver {

    /**
     * Returns the algorithm this solver implements; used as registry key.
     */
    SolverAlgorithm algorithm();

    /**
     * Builds one open route over the problem's assigned stops.
     *
     * @param problem immutable problem of the current run.
     * @return candidate route; never {@code null}.
     * @throws SolverException when no acceptable route is found or the solver was cancelled.
     */
    CandidateRoute solve(RoutingProblem problem);
}
