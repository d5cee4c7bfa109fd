package org.optiroute.routing.validation;

/**
 * Simulation risk by share of breaching scenarios.
 */
public enum RiskLevel {
    /** No scenario breaches. */
    LOW,
    /** At most half of the scenarios breach. */
    MEDIUM,
    /** More than half of the scenarios breach. */
    HIGH;

    static RiskLevel fromBreachRatio(double breachRatio) {
        if (breachRatio <= 0.0d) {
            return LOW;
        }
        return breachRatio <= 0.5d ? MEDIUM : HIGH;
    }
}
