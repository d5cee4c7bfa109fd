package org.optiroute.routing.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Greedy priority-weighted nearest-stop construction.
 *
 * <p>Never fails: a stop whose addition would breach max distance or max duration is skipped and
 * reported unassigned.</p>
 */
final class NearestNeighborSolver implements RouteSolver {

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.NEAREST_NEIGHBOR;
    }

    @Override
    public CandidateRoute solve(RoutingProblem problem) {
        RouteEvaluator evaluator = problem.evaluator();
        int size = problem.size();
        boolean[] done = new boolean[size];
        int[] tour = new int[size];
        int tourLength = 0;
        List<String> skipped = new ArrayList<>();

        int currentNode = 0;
        for (int remaining = size; remaining > 0; remaining--) {
            int best = -1;
            double bestScore = Double.POSITIVE_INFINITY;
            for (int stop = 0; stop < size; stop++) {
                if (done[stop]) {
                    continue;
                }
                double score = problem.nodeDistanceKm(currentNode, stop + 1)
                        / problem.stop(stop).effectivePriority().attractiveness();
                if (score < bestScore) {
                    bestScore = score;
                    best = stop;
                }
            }
            done[best] = true;
            tour[tourLength] = best;
            if (evaluator.breachesLimits(evaluator.evaluate(Arrays.copyOf(tour, tourLength + 1)))) {
                skipped.add(problem.stop(best).getId());
                continue;
            }
            tourLength++;
            currentNode = best + 1;
        }
        return evaluator.build(algorithm(), Arrays.copyOf(tour, tourLength), skipped);
    }

    /**
     * Unbounded greedy order over every stop, used to seed the metaheuristics.
     */
    static int[] greedyOrder(RoutingProblem problem) {
        int size = problem.size();
        boolean[] done = new boolean[size];
        int[] order = new int[size];
        int currentNode = 0;
        for (int position = 0; position < size; position++) {
            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int stop = 0; stop < size; stop++) {
                if (!done[stop] && problem.nodeDistanceKm(currentNode, stop + 1) < bestDistance) {
                    bestDistance = problem.nodeDistanceKm(currentNode, stop + 1);
                    best = stop;
                }
            }
            done[best] = true;
            order[position] = best;
            currentNode = best + 1;
        }
        return order;
    }
}
