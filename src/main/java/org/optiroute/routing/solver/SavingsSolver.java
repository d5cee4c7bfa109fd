package org.optiroute.routing.solver;

import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.Arrays;

/**
 * Clarke-Wright savings merge for one open route.
 *
 * <p>Every stop starts as its own route from the origin. Appending route {@code B} (head
 * {@code j}) to route {@code A} (tail {@code i}) saves {@code d(0, j) - d(i, j)}. Pairs are merged
 * in descending saving order until one route remains.</p>
 */
final class SavingsSolver implements RouteSolver {

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.SAVINGS;
    }

    @Override
    public CandidateRoute solve(RoutingProblem problem) {
        int size = problem.size();
        if (size <= 1) {
            return problem.evaluator().buildFeasible(algorithm(), problem.requestOrder());
        }

        long[] pairs = new long[pairCount(size)];
        double[] savings = new double[pairs.length];
        int[] rank = new int[pairs.length];
        int cursor = 0;
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                pairs[cursor] = ((long) i << 32) | j;
                savings[cursor] = problem.originDistanceKm(j) - problem.distanceKm(i, j);
                rank[cursor] = cursor;
                cursor++;
            }
        }
        IntArrays.quickSort(rank, (a, b) -> {
            int bySaving = Double.compare(savings[b], savings[a]);
            return bySaving != 0 ? bySaving : Long.compare(pairs[a], pairs[b]);
        });

        int[] next = new int[size];
        int[] previous = new int[size];
        int[] chain = new int[size];
        Arrays.fill(next, -1);
        Arrays.fill(previous, -1);
        for (int i = 0; i < size; i++) {
            chain[i] = i;
        }

        int merges = 0;
        for (int r = 0; r < rank.length && merges < size - 1; r++) {
            long pair = pairs[rank[r]];
            int tail = (int) (pair >>> 32);
            int head = (int) pair;
            if (next[tail] != -1 || previous[head] != -1) {
                continue;
            }
            if (findChain(chain, tail) == findChain(chain, head)) {
                continue;
            }
            next[tail] = head;
            previous[head] = tail;
            chain[findChain(chain, head)] = findChain(chain, tail);
            merges++;
        }

        int start = -1;
        for (int i = 0; i < size; i++) {
            if (previous[i] == -1) {
                start = i;
                break;
            }
        }
        int[] order = new int[size];
        int position = 0;
        for (int stop = start; stop != -1; stop = next[stop]) {
            order[position++] = stop;
        }
        return problem.evaluator().buildFeasible(algorithm(), order);
    }

    private static int findChain(int[] chain, int stop) {
        int root = stop;
        while (chain[root] != root) {
            root = chain[root];
        }
        while (chain[stop] != root) {
            int parent = chain[stop];
            chain[stop] = root;
            stop = parent;
        }
        return root;
    }

    /**
     * Ordered pairs of distinct stops.
     *
     * @throws ArithmeticException when the pair arrays would exceed the maximum array length.
     */
    static int pairCount(int size) {
        return Math.toIntExact((long) size * (size - 1));
    }
}
