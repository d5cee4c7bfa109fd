package org.optiroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.routing.context.ContextSource;
import org.optiroute.routing.solver.SolverAlgorithm;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Immutable run telemetry snapshot.
 */
@Value
@Builder
public class OptimizationTelemetry {

    /**
     * States visited in order, ending in {@code COMPLETED}.
     */
    @Singular("state")
    List<OptimizationState> stateHistory;

    /**
     * One entry per solver that was scheduled.
     */
    @Singular
    List<SolverOutcome> solverOutcomes;

    /**
     * Algorithm of the returned route, or {@code null} when no solver ran.
     */
    SolverAlgorithm selectedAlgorithm;

    boolean contextStale;

    @Singular
    Set<ContextSource> degradedSources;

    Duration elapsed;

    /**
     * Result of one solver task.
     *
     * @param algorithm solver algorithm.
     * @param succeeded whether a candidate was produced.
     * @param reasonCode failure reason code, {@code null} on success.
     * @param elapsed wall time of the task.
     */
    public record SolverOutcome(SolverAlgorithm algorithm, boolean succeeded, String reasonCode, Duration elapsed) {
    }
}
