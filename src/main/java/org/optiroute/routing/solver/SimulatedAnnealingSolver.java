package org.optiroute.routing.solver;

import java.util.Random;

/**
 * Simulated annealing over stop orders with geometric cooling.
 *
 * <p>Starts from the greedy nearest order. Each step applies one random move: 2-opt segment
 * reversal, pairwise swap, or relocation of one stop.</p>
 */
final class SimulatedAnnealingSolver implements RouteSolver {
    private static final int BUDGET_CHECK_MASK = 63;

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.SIMULATED_ANNEALING;
    }

    @Override
    public CandidateRoute solve(RoutingProblem problem) {
        RouteEvaluator evaluator = problem.evaluator();
        int size = problem.size();
        if (size <= 1) {
            return evaluator.buildFeasible(algorithm(), problem.requestOrder());
        }
        SolverSettings settings = problem.settings();
        SolverBudget budget = SolverBudget.start(algorithm(), settings.getSearchTimeLimit());
        Random random = new Random(settings.getSeed());

        int[] current = NearestNeighborSolver.greedyOrder(problem);
        double currentCost = evaluator.objective(current);
        int[] best = current.clone();
        double bestCost = currentCost;

        double temperature = settings.getAnnealingInitialTemperature();
        for (int iteration = 0; iteration < settings.getAnnealingIterations(); iteration++) {
            if ((iteration & BUDGET_CHECK_MASK) == 0) {
                budget.checkInterrupted();
                if (budget.exhausted()) {
                    break;
                }
            }
            if (temperature < settings.getAnnealingMinTemperature()) {
                break;
            }
            int[] neighbor = neighbor(current, random);
            double neighborCost = evaluator.objective(neighbor);
            double delta = neighborCost - currentCost;
            if (delta < 0.0d || random.nextDouble() < Math.exp(-delta / temperature)) {
                current = neighbor;
                currentCost = neighborCost;
                if (currentCost < bestCost) {
                    best = current.clone();
                    bestCost = currentCost;
                }
            }
            temperature *= settings.getAnnealingCoolingRate();
        }
        return evaluator.buildFeasible(algorithm(), best);
    }

    static int[] neighbor(int[] order, Random random) {
        int[] next = order.clone();
        int i = random.nextInt(next.length);
        int j = random.nextInt(next.length - 1);
        if (j >= i) {
            j++;
        }
        int low = Math.min(i, j);
        int high = Math.max(i, j);
        switch (random.nextInt(3)) {
            case 0 -> reverse(next, low, high);
            case 1 -> {
                int swap = next[i];
                next[i] = next[j];
                next[j] = swap;
            }
            default -> relocate(next, i, j);
        }
        return next;
    }

    private static void reverse(int[] order, int from, int to) {
        while (from < to) {
            int swap = order[from];
            order[from] = order[to];
            order[to] = swap;
            from++;
            to--;
        }
    }

    private static void relocate(int[] order, int from, int to) {
        int moved = order[from];
        if (from < to) {
            System.arraycopy(order, from + 1, order, from, to - from);
        } else {
            System.arraycopy(order, to, order, to + 1, from - to);
        }
        order[to] = moved;
    }
}
