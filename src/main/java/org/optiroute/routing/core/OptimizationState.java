package org.optiroute.routing.core;

/**
 * Lifecycle of one optimization run.
 */
public enum OptimizationState {
    COLLECTING_CONTEXT,
    RUNNING_SOLVERS,
    SELECTING_BEST,
    ENRICHING,
    RECOMMENDING,
    COMPLETED,
    /** Terminal; reachable from any other state. */
    FAILED
}
