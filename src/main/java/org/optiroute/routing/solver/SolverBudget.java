package org.optiroute.routing.solver;

import java.time.Duration;

/**
 * Per-solve wall-clock bound for iterative search.
 */
final class SolverBudget {
    private final SolverAlgorithm algorithm;
    private final long deadlineNanos;

    private SolverBudget(SolverAlgorithm algorithm, long deadlineNanos) {
        this.algorithm = algorithm;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Starts a budget of {@code limit} from now.
     */
    static SolverBudget start(SolverAlgorithm algorithm, Duration limit) {
        return new SolverBudget(algorithm, System.nanoTime() + limit.toNanos());
    }

    /**
     * Returns true once the search time limit has elapsed.
     */
    boolean exhausted() {
        return System.nanoTime() - deadlineNanos >= 0L;
    }

    /**
     * Fails fast when the orchestrator cancelled this solver.
     *
     * @throws SolverException with {@link SolverException#REASON_TIMEOUT} when interrupted.
     */
    void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw SolverException.timeout(algorithm, "solver interrupted before completion");
        }
    }
}
