package org.optiroute.routing.scoring;

/**
 * Route view consumed by side-by-side comparison.
 */
public interface ComparableRoute extends Rankable {

    /**
     * Stable id of the route within one comparison.
     */
    String routeId();

    double distanceKm();

    /**
     * Route efficiency in {@code [0, 1]}.
     */
    double efficiency();

    /**
     * Route feasibility in {@code [0, 1]}.
     */
    double feasibility();

    /**
     * Environmental score in {@code [0, 100]}.
     */
    double environmentalScore();
}
