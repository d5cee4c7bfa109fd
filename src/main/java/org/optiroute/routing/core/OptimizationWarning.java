package org.optiroute.routing.core;

import java.util.Objects;

/**
 * Non-fatal condition reported on a result.
 *
 * @param code stable warning code.
 * @param message human-readable detail.
 */
public record OptimizationWarning(String code, String message) {
    public static final String STALE_CONTEXT = "STALE_CONTEXT";
    public static final String BELOW_FEASIBILITY_THRESHOLD = "BELOW_FEASIBILITY_THRESHOLD";
    public static final String UNASSIGNED_DESTINATIONS = "UNASSIGNED_DESTINATIONS";
    public static final String EVENT_PUBLISH_FAILED = "EVENT_PUBLISH_FAILED";

    public OptimizationWarning {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }
}
