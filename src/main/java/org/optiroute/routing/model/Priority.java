package org.optiroute.routing.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Delivery priority of one destination.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Priority {
    HIGH(1.5d),
    MEDIUM(1.0d),
    LOW(0.75d);

    /** Divisor applied to travel distance when greedy construction ranks the next stop. */
    private final double attractiveness;
}
