package org.optiroute.routing.solver;

import lombok.Getter;

/**
 * Reason-coded failure of one solver.
 *
 * <p>The orchestrator recovers these locally: the failing solver is excluded from selection and
 * the failure is recorded in telemetry.</p>
 */
@Getter
public final class SolverException extends RuntimeException {
    public static final String REASON_TIMEOUT = "SOL_TIMEOUT";
    public static final String REASON_INFEASIBLE = "SOL_INFEASIBLE";
    public static final String REASON_FAILED = "SOL_FAILED";

    private final SolverAlgorithm algorithm;
    private final String reasonCode;

    public SolverException(SolverAlgorithm algorithm, String reasonCode, String message) {
        this(algorithm, reasonCode, message, null);
    }

    public SolverException(SolverAlgorithm algorithm, String reasonCode, String message, Throwable cause) {
        super("[" + reasonCode + "] " + algorithm.id() + ": " + message, cause);
        this.algorithm = algorithm;
        this.reasonCode = reasonCode;
    }

    /**
     * Creates a timeout failure.
     */
    public static SolverException timeout(SolverAlgorithm algorithm, String message) {
        return new SolverException(algorithm, REASON_TIMEOUT, message);
    }

    /**
     * Creates an infeasibility failure.
     */
    public static SolverException infeasible(SolverAlgorithm algorithm, String message) {
        return new SolverException(algorithm, REASON_INFEASIBLE, message);
    }

    /**
     * Wraps an unexpected runtime failure.
     */
    public static SolverException failed(SolverAlgorithm algorithm, Throwable cause) {
        return new SolverException(algorithm, REASON_FAILED, String.valueOf(cause.getMessage()), cause);
    }
}
