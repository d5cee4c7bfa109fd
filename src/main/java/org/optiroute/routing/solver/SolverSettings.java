package org.optiroute.routing.solver;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable tuning for the solver strategy set.
 */
@Value
@Builder(toBuilder = true)
public class SolverSettings {
    public static final long DEFAULT_SEED = 42L;
    public static final Duration DEFAULT_SOLVER_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SEARCH_TIME_LIMIT = Duration.ofSeconds(2);
    public static final double DEFAULT_ROAD_CIRCUITY_FACTOR = 1.2d;

    /** Seed for every randomized solver; equal seeds give equal results. */
    @Builder.Default
    long seed = DEFAULT_SEED;
    /** Hard bound on one solver task, enforced by the orchestrator. */
    @Builder.Default
    Duration solverTimeout = DEFAULT_SOLVER_TIMEOUT;
    /** Soft wall-clock bound after which metaheuristics return their best tour. */
    @Builder.Default
    Duration searchTimeLimit = DEFAULT_SEARCH_TIME_LIMIT;

    /** Great-circle to road distance factor. */
    @Builder.Default
    double roadCircuityFactor = DEFAULT_ROAD_CIRCUITY_FACTOR;
    /** Speed factor applied when highways are avoided. */
    @Builder.Default
    double highwayAvoidanceSpeedFactor = 0.85d;
    /** Objective weight of one late minute, in km-equivalents. */
    @Builder.Default
    double latenessWeightPerMinute = 1.0d;

    @Builder.Default
    int annealingIterations = 5_000;
    @Builder.Default
    double annealingInitialTemperature = 100.0d;
    @Builder.Default
    double annealingCoolingRate = 0.995d;
    @Builder.Default
    double annealingMinTemperature = 0.01d;

    @Builder.Default
    int geneticPopulationSize = 40;
    @Builder.Default
    int geneticGenerations = 150;
    @Builder.Default
    double geneticMutationRate = 0.15d;
    @Builder.Default
    int geneticTournamentSize = 3;
    @Builder.Default
    int geneticEliteCount = 2;

    @Builder.Default
    int antCount = 15;
    @Builder.Default
    int antIterations = 60;
    @Builder.Default
    double antPheromoneWeight = 1.0d;
    @Builder.Default
    double antHeuristicWeight = 3.0d;
    @Builder.Default
    double antEvaporationRate = 0.3d;
    @Builder.Default
    double antPheromoneDeposit = 100.0d;

    /**
     * Returns settings with every default.
     */
    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }

    /**
     * Validates settings consistency.
     *
     * @throws IllegalArgumentException when any setting is out of range.
     */
    public SolverSettings validate() {
        requirePositive(solverTimeout, "solverTimeout");
        requirePositive(searchTimeLimit, "searchTimeLimit");
        if (!(roadCircuityFactor >= 1.0d) || !Double.isFinite(roadCircuityFactor)) {
            throw new IllegalArgumentException("roadCircuityFactor must be finite and >= 1");
        }
        if (!(highwayAvoidanceSpeedFactor > 0.0d && highwayAvoidanceSpeedFactor <= 1.0d)) {
            throw new IllegalArgumentException("highwayAvoidanceSpeedFactor must be in (0, 1]");
        }
        if (!(latenessWeightPerMinute >= 0.0d)) {
            throw new IllegalArgumentException("latenessWeightPerMinute must be >= 0");
        }
        if (!(annealingCoolingRate > 0.0d && annealingCoolingRate < 1.0d)) {
            throw new IllegalArgumentException("annealingCoolingRate must be in (0, 1)");
        }
        if (!(antEvaporationRate > 0.0d && antEvaporationRate < 1.0d)) {
            throw new IllegalArgumentException("antEvaporationRate must be in (0, 1)");
        }
        if (annealingIterations <= 0 || geneticPopulationSize < 2 || geneticGenerations <= 0
                || antCount <= 0 || antIterations <= 0) {
            throw new IllegalArgumentException("iteration and population bounds must be positive");
        }
        if (geneticTournamentSize <= 0 || geneticEliteCount < 0 || geneticEliteCount >= geneticPopulationSize) {
            throw new IllegalArgumentException("genetic tournament/elite sizes out of range");
        }
        return this;
    }

    private static void requirePositive(Duration duration, String fieldName) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(fieldName + " must be > 0");
        }
    }
}
