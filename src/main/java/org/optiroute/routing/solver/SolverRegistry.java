package org.optiroute.routing.solver;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of route solvers keyed by algorithm.
 */
public final class SolverRegistry {
    private static final List<RouteSolver> BUILT_INS = List.of(
            new NearestNeighborSolver(),
            new SavingsSolver(),
            new SimulatedAnnealingSolver(),
            new GeneticSolver(),
            new AntColonySolver()
    );

    private final Map<SolverAlgorithm, RouteSolver> solversByAlgorithm;

    /**
     * Creates a registry with built-in solvers only.
     */
    public SolverRegistry() {
        this(List.of(), true);
    }

    /**
     * Creates a registry by merging built-ins with custom solvers; custom solvers replace the
     * built-in registered for the same algorithm.
     */
    public SolverRegistry(Collection<? extends RouteSolver> customSolvers) {
        this(customSolvers, true);
    }

    /**
     * Creates an explicit registry from provided solvers.
     */
    public SolverRegistry(Collection<? extends RouteSolver> solvers, boolean includeBuiltIns) {
        EnumMap<SolverAlgorithm, RouteSolver> map = new EnumMap<>(SolverAlgorithm.class);
        if (includeBuiltIns) {
            register(map, BUILT_INS);
        }
        if (solvers != null) {
            register(map, solvers);
        }
        if (map.isEmpty()) {
            throw new IllegalArgumentException("solver registry must contain at least one solver");
        }
        this.solversByAlgorithm = Collections.unmodifiableMap(map);
    }

    /**
     * Returns solver by algorithm, or null when not registered.
     */
    public RouteSolver solver(SolverAlgorithm algorithm) {
        if (algorithm == null) {
            return null;
        }
        return solversByAlgorithm.get(algorithm);
    }

    /**
     * Returns registered algorithms in declaration order.
     */
    public Set<SolverAlgorithm> algorithms() {
        return solversByAlgorithm.keySet();
    }

    /**
     * Returns registered solvers in algorithm declaration order.
     */
    public Collection<RouteSolver> solvers() {
        return solversByAlgorithm.values();
    }

    /**
     * Returns a new default registry instance.
     */
    public static SolverRegistry defaultRegistry() {
        return new SolverRegistry();
    }

    private static void register(EnumMap<SolverAlgorithm, RouteSolver> map, Collection<? extends RouteSolver> solvers) {
        for (RouteSolver solver : solvers) {
            RouteSolver nonNullSolver = Objects.requireNonNull(solver, "solver");
            map.put(Objects.requireNonNull(nonNullSolver.algorithm(), "solver.algorithm"), nonNullSolver);
        }
    }
}
