package org.optiroute.routing.solver;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Built-in route-construction algorithms.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SolverAlgorithm {
    NEAREST_NEIGHBOR(
            "nearest_neighbor",
            "Nearest Neighbor",
            "Greedy priority-weighted nearest stop; fast fallback that never fails",
            false
    ),
    SAVINGS(
            "savings",
            "Clarke-Wright Savings",
            "Pairwise merge of single-stop routes by distance saved",
            false
    ),
    SIMULATED_ANNEALING(
            "simulated_annealing",
            "Simulated Annealing",
            "2-opt, swap and relocate moves under geometric cooling",
            true
    ),
    GENETIC(
            "genetic",
            "Genetic Algorithm",
            "Order crossover, swap mutation, tournament selection with elitism",
            true
    ),
    ANT_COLONY(
            "ant_colony",
            "Ant Colony Optimization",
            "Pheromone-trail tour construction with evaporation",
            true
    );

    private final String id;
    private final String displayName;
    private final String description;
    /** True when the algorithm is randomized and seeded. */
    private final boolean metaheuristic;

    /**
     * Resolves an algorithm from its stable id or enum name.
     *
     * @throws IllegalArgumentException when no algorithm matches.
     */
    public static SolverAlgorithm fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("algorithm id must be non-blank");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (SolverAlgorithm algorithm : values()) {
            if (algorithm.id.equals(normalized) || algorithm.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("unknown algorithm id: " + id);
    }
}
