package org.optiroute.routing.context;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Road surface condition reported by the weather feed.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum RoadCondition {
    DRY(1.0d, 1.0d, false),
    WET(1.1d, 0.9d, false),
    ICY(1.2d, 0.6d, true),
    SNOWY(1.25d, 0.65d, true),
    SEVERE(1.3d, 0.5d, true);

    /** Multiplier applied to fuel consumption. */
    private final double fuelMultiplier;
    /** Multiplier applied to effective travel speed. */
    private final double speedFactor;
    /** True when the condition calls for safety measures. */
    private final boolean hazardous;
}
