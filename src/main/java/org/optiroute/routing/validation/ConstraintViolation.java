package org.optiroute.routing.validation;

/**
 * One validation finding.
 *
 * @param constraint violated constraint id.
 * @param severity error or warning.
 * @param message human-readable text.
 * @param destinationId affected stop, or {@code null} for route-level findings.
 */
public record ConstraintViolation(
        String constraint,
        ViolationSeverity severity,
        String message,
        String destinationId
) {
}
