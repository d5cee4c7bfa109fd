package org.optiroute.routing.solver;

import java.util.Arrays;
import java.util.Random;

/**
 * Ant-colony tour construction over the origin-rooted distance matrix.
 *
 * <p>Arc desirability is {@code pheromone^alpha * (attractiveness / distance)^beta}. Trails
 * evaporate after every iteration and each ant deposits {@code Q / objective} on its arcs.</p>
 */
final class AntColonySolver implements RouteSolver {
    private static final double INITIAL_PHEROMONE = 1.0d;
    private static final double MIN_DISTANCE_KM = 1e-6d;
    private static final double MIN_OBJECTIVE = 1e-6d;

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.ANT_COLONY;
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

        int nodes = size + 1;
        double[][] pheromone = new double[nodes][nodes];
        double[][] desirability = new double[nodes][nodes];
        for (int from = 0; from < nodes; from++) {
            Arrays.fill(pheromone[from], INITIAL_PHEROMONE);
            for (int to = 1; to < nodes; to++) {
                double attractiveness = problem.stop(to - 1).effectivePriority().attractiveness();
                double distance = Math.max(problem.nodeDistanceKm(from, to), MIN_DISTANCE_KM);
                desirability[from][to] = Math.pow(attractiveness / distance, settings.getAntHeuristicWeight());
            }
        }

        int[] best = NearestNeighborSolver.greedyOrder(problem);
        double bestCost = evaluator.objective(best);
        int[][] tours = new int[settings.getAntCount()][];
        double[] costs = new double[settings.getAntCount()];
        double[] weights = new double[nodes];

        for (int iteration = 0; iteration < settings.getAntIterations(); iteration++) {
            budget.checkInterrupted();
            if (budget.exhausted()) {
                break;
            }
            for (int ant = 0; ant < tours.length; ant++) {
                tours[ant] = constructTour(size, pheromone, desirability, settings.getAntPheromoneWeight(), weights, random);
                costs[ant] = evaluator.objective(tours[ant]);
                if (costs[ant] < bestCost) {
                    bestCost = costs[ant];
                    best = tours[ant].clone();
                }
            }

            double retention = 1.0d - settings.getAntEvaporationRate();
            for (double[] row : pheromone) {
                for (int to = 0; to < row.length; to++) {
                    row[to] *= retention;
                }
            }
            for (int ant = 0; ant < tours.length; ant++) {
                double deposit = settings.getAntPheromoneDeposit() / Math.max(costs[ant], MIN_OBJECTIVE);
                int previous = 0;
                for (int stop : tours[ant]) {
                    pheromone[previous][stop + 1] += deposit;
                    previous = stop + 1;
                }
            }
        }
        return evaluator.buildFeasible(algorithm(), best);
    }

    private static int[] constructTour(
            int size,
            double[][] pheromone,
            double[][] desirability,
            double alpha,
            double[] weights,
            Random random
    ) {
        boolean[] visited = new boolean[size + 1];
        int[] tour = new int[size];
        int current = 0;
        for (int step = 0; step < size; step++) {
            double total = 0.0d;
            int fallback = -1;
            for (int node = 1; node <= size; node++) {
                if (visited[node]) {
                    weights[node] = 0.0d;
                    continue;
                }
                fallback = node;
                weights[node] = Math.pow(pheromone[current][node], alpha) * desirability[current][node];
                total += weights[node];
            }
            int chosen = fallback;
            if (total > 0.0d && Double.isFinite(total)) {
                double pick = random.nextDouble() * total;
                for (int node = 1; node <= size; node++) {
                    if (visited[node]) {
                        continue;
                    }
                    pick -= weights[node];
                    if (pick <= 0.0d) {
                        chosen = node;
                        break;
                    }
                }
            }
            visited[chosen] = true;
            tour[step] = chosen - 1;
            current = chosen;
        }
        return tour;
    }
}
