package org.optiroute.routing.cost;

/**
 * Cost components of one route.
 *
 * <p>The total is derived from the components and cannot disagree with them.</p>
 *
 * @param fuelCost fuel consumption times unit price.
 * @param driverCost driver hourly rate times route hours.
 * @param vehicleCost per-km vehicle rate times distance.
 * @param tollCost per-km toll times distance; 0 when tolls are avoided.
 * @param penaltyCost lateness penalties; 0 for an on-time route.
 * @param fuelConsumption fuel units used (liters, or kWh for electric).
 * @param costSavings saving against the baseline estimate; never negative.
 */
public record CostBreakdown(
        double fuelCost,
        double driverCost,
        double vehicleCost,
        double tollCost,
        double penaltyCost,
        double fuelConsumption,
        double costSavings
) {
    private static final CostBreakdown ZERO = new CostBreakdown(0.0d, 0.0d, 0.0d, 0.0d, 0.0d, 0.0d, 0.0d);

    public CostBreakdown {
        if (costSavings < 0.0d) {
            throw new IllegalArgumentException("costSavings must be >= 0, got " + costSavings);
        }
    }

    /**
     * Breakdown of a route that goes nowhere.
     */
    public static CostBreakdown zero() {
        return ZERO;
    }

    /**
     * Sum of all cost components.
     */
    public double total() {
        return fuelCost + driverCost + vehicleCost + tollCost + penaltyCost;
    }
}
