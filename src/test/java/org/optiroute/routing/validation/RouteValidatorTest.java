package org.optiroute.routing.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.TimeWindow;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.Stop;
import org.optiroute.routing.testutil.RoutingFixtures;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteValidatorTest {

    private final RouteValidator validator = new RouteValidator();

    private static CandidateRoute onTimeRoute() {
        CandidateRoute route = RoutingFixtures.twoStopRoute();
        List<Stop> stops = new ArrayList<>(route.getStops());
        stops.set(1, stops.get(1).toBuilder()
                .timeWindow(TimeWindow.of(RoutingFixtures.DEPARTURE, RoutingFixtures.DEPARTURE.plusSeconds(3_600)))
                .latenessMinutes(0.0d)
                .build());
        return route.toBuilder().clearStops().stops(stops).build();
    }

    private static List<String> constraints(ValidationResult result) {
        List<String> ids = new ArrayList<>();
        for (ConstraintViolation violation : result.getViolations()) {
            ids.add(violation.constraint());
        }
        return ids;
    }

    @Test
    @DisplayName("Route inside every limit is valid with full feasibility")
    void testValidRoute() {
        ValidationResult result = validator.validate(onTimeRoute(), Constraints.unbounded(), RoutingFixtures.van());

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals(1.0d, result.getFeasibilityScore(), 0.0d);
    }

    @Test
    @DisplayName("Late arrival is an error tied to its stop")
    void testLateArrival() {
        ValidationResult result = validator.validate(RoutingFixtures.twoStopRoute(), null);

        assertFalse(result.isValid());
        assertEquals(List.of(RouteValidator.CONSTRAINT_TIME_WINDOW), constraints(result));
        assertEquals("b", result.getViolations().get(0).destinationId());
        assertEquals(ViolationSeverity.ERROR, result.getViolations().get(0).severity());
        assertEquals(0.75d, result.getFeasibilityScore(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "10, Infinity, MAX_DISTANCE",
            "Infinity, 30, MAX_DURATION"
    })
    @DisplayName("Route-level limits are errors")
    void testRouteLimits(double maxDistanceKm, double maxDurationMinutes, String expected) {
        Constraints limits = Constraints.builder()
                .maxDistanceKm(maxDistanceKm)
                .maxRouteDurationMinutes(maxDurationMinutes)
                .build();

        ValidationResult result = validator.validate(onTimeRoute(), limits);

        assertFalse(result.isValid());
        assertEquals(List.of(expected), constraints(result));
    }

    @Test
    @DisplayName("Arrival close to window end is a warning")
    void testTightWindow() {
        CandidateRoute route = onTimeRoute();
        List<Stop> stops = new ArrayList<>(route.getStops());
        stops.set(1, stops.get(1).toBuilder()
                .timeWindow(TimeWindow.of(RoutingFixtures.DEPARTURE, RoutingFixtures.DEPARTURE.plusSeconds(35 * 60)))
                .build());

        ValidationResult result = validator.validate(route.toBuilder().clearStops().stops(stops).build(), null);

        assertTrue(result.isValid());
        assertEquals(List.of(RouteValidator.CONSTRAINT_TIGHT_WINDOW), constraints(result));
        assertEquals(1, result.getWarnings().size());
        assertEquals(0.95d, result.getFeasibilityScore(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "90, WEIGHT_CAPACITY, false",
            "105, NEAR_CAPACITY, true",
            "1000, , true"
    })
    @DisplayName("Load is checked against vehicle capacity")
    void testCapacity(double capacityKg, String expected, boolean valid) {
        ValidationResult result = validator.validate(
                onTimeRoute(), null, RoutingFixtures.van().toBuilder().capacityKg(capacityKg).build());

        assertEquals(valid, result.isValid());
        assertEquals(expected == null ? List.of() : List.of(expected), constraints(result));
    }

    @Test
    @DisplayName("Totals that disagree with stops are errors")
    void testInconsistentTotals() {
        CandidateRoute route = onTimeRoute().toBuilder().totalDistanceKm(20.0d).build();

        ValidationResult result = validator.validate(route, null);

        assertEquals(List.of(RouteValidator.CONSTRAINT_DISTANCE_TOTAL), constraints(result));
    }

    @Test
    @DisplayName("Out-of-order arrivals are errors")
    void testArrivalOrder() {
        CandidateRoute route = onTimeRoute();
        List<Stop> stops = new ArrayList<>(route.getStops());
        stops.set(1, stops.get(1).toBuilder().arrivalTime(RoutingFixtures.DEPARTURE.plusSeconds(60)).build());

        ValidationResult result = validator.validate(route.toBuilder().clearStops().stops(stops).build(), null);

        assertEquals(List.of(RouteValidator.CONSTRAINT_ARRIVAL_ORDER), constraints(result));
    }

    @Test
    @DisplayName("Feasibility never drops below zero")
    void testFeasibilityFloor() {
        Constraints strict = Constraints.builder().maxDistanceKm(1.0d).maxRouteDurationMinutes(1.0d).build();
        CandidateRoute route = RoutingFixtures.twoStopRoute().toBuilder().totalDistanceKm(99.0d).build();

        ValidationResult result = validator.validate(
                route, strict, RoutingFixtures.van().toBuilder().capacityKg(1.0d).volumeCapacityM3(0.1d).build());

        assertTrue(result.getErrors().size() >= 4);
        assertEquals(0.0d, result.getFeasibilityScore(), 0.0d);
    }

    @Test
    @DisplayName("Validation is idempotent and leaves the route untouched")
    void testIdempotent() {
        CandidateRoute route = RoutingFixtures.twoStopRoute();
        CandidateRoute copy = route.toBuilder().build();

        ValidationResult first = validator.validate(route, Constraints.unbounded(), RoutingFixtures.van());
        ValidationResult second = validator.validate(route, Constraints.unbounded(), RoutingFixtures.van());

        assertEquals(first, second);
        assertEquals(copy, route);
    }

    @Test
    @DisplayName("Invalid thresholds are rejected")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RouteValidator(-1.0d, 0.9d));
        assertThrows(IllegalArgumentException.class, () -> new RouteValidator(15.0d, 1.5d));
    }
}
