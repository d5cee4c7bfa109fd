package org.optiroute.routing.core;

/**
 * Constraint a caller can set on a request.
 *
 * @param id stable identifier.
 * @param description what the constraint limits.
 * @param unit value unit, or {@code null} for flags.
 */
public record ConstraintDescriptor(String id, String description, String unit) {
}
