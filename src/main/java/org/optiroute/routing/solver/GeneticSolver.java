package org.optiroute.routing.solver;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

/**
 * Generational genetic search over stop orders.
 *
 * <p>Order crossover, swap mutation, tournament selection and elitism. The initial population
 * holds the greedy order, the request order and seeded random permutations.</p>
 */
final class GeneticSolver implements RouteSolver {

    /**
     * One scored individual.
     */
    private record Individual(int[] order, double cost) {
    }

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.GENETIC;
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
        int populationSize = settings.getGeneticPopulationSize();

        Individual[] population = new Individual[populationSize];
        population[0] = score(evaluator, NearestNeighborSolver.greedyOrder(problem));
        population[1] = score(evaluator, problem.requestOrder());
        for (int i = 2; i < populationSize; i++) {
            population[i] = score(evaluator, shuffled(problem.requestOrder(), random));
        }
        Arrays.sort(population, Comparator.comparingDouble(Individual::cost));

        for (int generation = 0; generation < settings.getGeneticGenerations(); generation++) {
            budget.checkInterrupted();
            if (budget.exhausted()) {
                break;
            }
            Individual[] offspring = new Individual[populationSize];
            int elites = settings.getGeneticEliteCount();
            System.arraycopy(population, 0, offspring, 0, elites);
            for (int i = elites; i < populationSize; i++) {
                int[] first = tournament(population, settings.getGeneticTournamentSize(), random).order();
                int[] second = tournament(population, settings.getGeneticTournamentSize(), random).order();
                int[] child = orderCrossover(first, second, random);
                if (random.nextDouble() < settings.getGeneticMutationRate()) {
                    swapMutation(child, random);
                }
                offspring[i] = score(evaluator, child);
            }
            Arrays.sort(offspring, Comparator.comparingDouble(Individual::cost));
            population = offspring;
        }
        return evaluator.buildFeasible(algorithm(), population[0].order());
    }

    static int[] orderCrossover(int[] first, int[] second, Random random) {
        int length = first.length;
        int cutA = random.nextInt(length);
        int cutB = random.nextInt(length);
        int low = Math.min(cutA, cutB);
        int high = Math.max(cutA, cutB);

        int[] child = new int[length];
        boolean[] used = new boolean[length];
        for (int i = low; i <= high; i++) {
            child[i] = first[i];
            used[first[i]] = true;
        }
        int write = (high + 1) % length;
        for (int k = 0; k < length; k++) {
            int gene = second[(high + 1 + k) % length];
            if (used[gene]) {
                continue;
            }
            child[write] = gene;
            used[gene] = true;
            write = (write + 1) % length;
        }
        return child;
    }

    private static void swapMutation(int[] order, Random random) {
        int i = random.nextInt(order.length);
        int j = random.nextInt(order.length);
        int swap = order[i];
        order[i] = order[j];
        order[j] = swap;
    }

    private static Individual tournament(Individual[] population, int tournamentSize, Random random) {
        Individual best = population[random.nextInt(population.length)];
        for (int i = 1; i < tournamentSize; i++) {
            Individual contender = population[random.nextInt(population.length)];
            if (contender.cost() < best.cost()) {
                best = contender;
            }
        }
        return best;
    }

    private static int[] shuffled(int[] order, Random random) {
        int[] copy = order.clone();
        for (int i = copy.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int swap = copy[i];
            copy[i] = copy[j];
            copy[j] = swap;
        }
        return copy;
    }

    private static Individual score(RouteEvaluator evaluator, int[] order) {
        return new Individual(order, evaluator.objective(order));
    }
}
