package org.optiroute.routing.scoring;

/**
 * Route view consumed by the ranking engine.
 */
public interface Rankable {

    /**
     * Total cost in currency units.
     */
    double rankingCost();

    /**
     * End-to-end duration in hours.
     */
    double rankingDurationHours();

    /**
     * Total CO2 in kg.
     */
    double rankingCo2Kg();
}
