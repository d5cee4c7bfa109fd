package org.optiroute.routing.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RoadCondition;
import org.optiroute.routing.context.TimeFactors;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.Stop;
import org.optiroute.routing.testutil.RoutingFixtures;

import static org.junit.jupiter.api.Assertions.*;

class CostModelTest {

    private final CostModel model = new CostModel(CostModelConfig.defaults());

    @Test
    @DisplayName("Components follow the default rate table")
    void testComponents() {
        CostBreakdown cost = model.computeCost(
                RoutingFixtures.twoStopRoute(), RoutingFixtures.neutralContext(), RoutingFixtures.van());

        assertEquals(1.2d, cost.fuelConsumption(), 1e-9);
        assertEquals(27.0d, cost.fuelCost(), 1e-9);
        assertEquals(27.5d, cost.driverCost(), 1e-9);
        assertEquals(30.0d, cost.vehicleCost(), 1e-9);
        assertEquals(1.5d, cost.tollCost(), 1e-9);
        assertEquals(106.0d, cost.penaltyCost(), 1e-9);
        assertEquals(192.0d, cost.total(), 1e-9);
        assertEquals(192.0d * 0.2d, cost.costSavings(), 1e-9);
    }

    @Test
    @DisplayName("Total equals the sum of its components")
    void testTotalIsSumOfComponents() {
        RealTimeContext icy = RoutingFixtures.neutralContext().toBuilder()
                .weather(RoutingFixtures.neutralContext().getWeather().toBuilder()
                        .roadCondition(RoadCondition.ICY).build())
                .timeFactors(TimeFactors.builder().rushHour(true).trafficMultiplier(1.3d).build())
                .build();
        CostBreakdown cost = model.computeCost(RoutingFixtures.twoStopRoute(), icy, RoutingFixtures.van());

        double sum = cost.fuelCost() + cost.driverCost() + cost.vehicleCost() + cost.tollCost() + cost.penaltyCost();
        assertEquals(sum, cost.total(), 1e-6);
        assertEquals(15.0d * 0.08d * 1.3d * 1.2d, cost.fuelConsumption(), 1e-9);
        assertTrue(cost.costSavings() >= 0.0d);
    }

    @Test
    @DisplayName("Avoiding tolls zeroes toll cost only")
    void testAvoidTolls() {
        CandidateRoute route = RoutingFixtures.twoStopRoute();
        Constraints avoid = Constraints.builder().avoidTolls(true).build();

        CostBreakdown withTolls = model.computeCost(route, RoutingFixtures.neutralContext(), RoutingFixtures.van());
        CostBreakdown noTolls = model.computeCost(route, RoutingFixtures.neutralContext(), RoutingFixtures.van(), avoid);

        assertEquals(0.0d, noTolls.tollCost(), 0.0d);
        assertEquals(withTolls.fuelCost(), noTolls.fuelCost(), 1e-12);
        assertEquals(withTolls.total() - withTolls.tollCost(), noTolls.total(), 1e-9);
    }

    @Test
    @DisplayName("On-time route with no distance costs nothing")
    void testEmptyRoute() {
        CandidateRoute empty = CandidateRoute.builder()
                .departureTime(RoutingFixtures.DEPARTURE)
                .build();

        CostBreakdown cost = model.computeCost(empty, RoutingFixtures.neutralContext(), RoutingFixtures.van());

        assertEquals(0.0d, cost.total(), 0.0d);
        assertEquals(0.0d, cost.costSavings(), 0.0d);
    }

    @Test
    @DisplayName("Electric vehicles use the kWh rate and price")
    void testElectricVehicle() {
        CostBreakdown cost = model.computeCost(
                RoutingFixtures.twoStopRoute(),
                RoutingFixtures.neutralContext(),
                RoutingFixtures.van().toBuilder().fuelType(FuelType.ELECTRIC).build());

        assertEquals(3.0d, cost.fuelConsumption(), 1e-9);
        assertEquals(3.0d * 1.80d, cost.fuelCost(), 1e-9);
    }

    @Test
    @DisplayName("Stop costs add up to the route total")
    void testAttributeStopCosts() {
        CandidateRoute route = RoutingFixtures.twoStopRoute();

        CandidateRoute costed = model.attributeStopCosts(
                route, RoutingFixtures.neutralContext(), RoutingFixtures.van(), Constraints.unbounded());
        CostBreakdown total = model.computeCost(route, RoutingFixtures.neutralContext(), RoutingFixtures.van());

        double sum = 0.0d;
        for (Stop stop : costed.getStops()) {
            assertTrue(stop.getIncrementalCost() > 0.0d);
            sum += stop.getIncrementalCost();
        }
        assertEquals(total.total(), sum, 1e-6);
        assertTrue(costed.getStops().get(1).getIncrementalCost() > costed.getStops().get(0).getIncrementalCost());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0d, 0.99d, Double.NaN})
    @DisplayName("Baseline multiplier below 1 is rejected")
    void testBaselineMultiplierValidation(double multiplier) {
        CostModelConfig config = CostModelConfig.defaults().toBuilder().baselineMultiplier(multiplier).build();

        assertThrows(IllegalArgumentException.class, () -> new CostModel(config));
    }

    @Test
    @DisplayName("Missing consumption rate is rejected")
    void testMissingConsumptionRate() {
        CostModelConfig config = CostModelConfig.builder().consumptionRate(FuelType.DIESEL, 0.08d).build();

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    @DisplayName("Negative savings cannot be constructed")
    void testNegativeSavingsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new CostBreakdown(1.0d, 0.0d, 0.0d, 0.0d, 0.0d, 0.0d, -0.1d));
    }
}
