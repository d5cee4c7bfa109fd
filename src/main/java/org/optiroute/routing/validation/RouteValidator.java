package org.optiroute.routing.validation;

import org.optiroute.core.time.TimeUtils;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.Stop;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pure, idempotent constraint validation of a candidate route.
 */
public final class RouteValidator {
    public static final String CONSTRAINT_MAX_DISTANCE = "MAX_DISTANCE";
    public static final String CONSTRAINT_MAX_DURATION = "MAX_DURATION";
    public static final String CONSTRAINT_TIME_WINDOW = "TIME_WINDOW";
    public static final String CONSTRAINT_DISTANCE_TOTAL = "DISTANCE_TOTAL";
    public static final String CONSTRAINT_ARRIVAL_ORDER = "ARRIVAL_ORDER";
    public static final String CONSTRAINT_WEIGHT_CAPACITY = "WEIGHT_CAPACITY";
    public static final String CONSTRAINT_VOLUME_CAPACITY = "VOLUME_CAPACITY";
    public static final String CONSTRAINT_TIGHT_WINDOW = "TIGHT_WINDOW";
    public static final String CONSTRAINT_NEAR_CAPACITY = "NEAR_CAPACITY";

    public static final double DEFAULT_TIGHT_WINDOW_SLACK_MINUTES = 15.0d;
    public static final double DEFAULT_NEAR_CAPACITY_RATIO = 0.9d;

    private static final double ERROR_WEIGHT = 0.25d;
    private static final double WARNING_WEIGHT = 0.05d;
    private static final double DISTANCE_TOLERANCE = 1e-6d;

    private final double tightWindowSlackMinutes;
    private final double nearCapacityRatio;

    public RouteValidator() {
        this(DEFAULT_TIGHT_WINDOW_SLACK_MINUTES, DEFAULT_NEAR_CAPACITY_RATIO);
    }

    public RouteValidator(double tightWindowSlackMinutes, double nearCapacityRatio) {
        if (!(tightWindowSlackMinutes >= 0.0d)) {
            throw new IllegalArgumentException("tightWindowSlackMinutes must be >= 0");
        }
        if (!(nearCapacityRatio > 0.0d && nearCapacityRatio <= 1.0d)) {
            throw new IllegalArgumentException("nearCapacityRatio must be in (0, 1]");
        }
        this.tightWindowSlackMinutes = tightWindowSlackMinutes;
        this.nearCapacityRatio = nearCapacityRatio;
    }

    /**
     * Validates a route without capacity checks.
     */
    public ValidationResult validate(CandidateRoute route, Constraints constraints) {
        return validate(route, constraints, null);
    }

    /**
     * Validates a route.
     *
     * @param route route to validate; never modified.
     * @param constraints limits to check (nullable for unbounded).
     * @param vehicle vehicle whose capacity is checked (nullable to skip capacity checks).
     */
    public ValidationResult validate(CandidateRoute route, Constraints constraints, VehicleProfile vehicle) {
        Objects.requireNonNull(route, "route");
        Constraints limits = constraints == null ? Constraints.unbounded() : constraints;
        List<ConstraintViolation> violations = new ArrayList<>();

        if (route.getTotalDistanceKm() > limits.getMaxDistanceKm()) {
            violations.add(error(CONSTRAINT_MAX_DISTANCE, String.format(
                    "Route distance %.2f km exceeds limit %.2f km", route.getTotalDistanceKm(), limits.getMaxDistanceKm()), null));
        }
        if (route.getTotalDurationMinutes() > limits.getMaxRouteDurationMinutes()) {
            violations.add(error(CONSTRAINT_MAX_DURATION, String.format(
                    "Route duration %.1f min exceeds limit %.1f min",
                    route.getTotalDurationMinutes(), limits.getMaxRouteDurationMinutes()), null));
        }

        double stopDistance = 0.0d;
        List<Instant> arrivals = new ArrayList<>(route.getStops().size());
        for (Stop stop : route.getStops()) {
            stopDistance += stop.getDistanceFromPreviousKm();
            arrivals.add(stop.getArrivalTime());
            if (stop.getTimeWindow() == null || stop.getArrivalTime() == null) {
                continue;
            }
            double lateness = stop.getTimeWindow().latenessMinutes(stop.getArrivalTime());
            if (lateness > 0.0d) {
                violations.add(error(CONSTRAINT_TIME_WINDOW, String.format(
                        "Stop %s arrives %.1f min after its window closes", stop.getDestinationId(), lateness),
                        stop.getDestinationId()));
            } else {
                double slack = stop.getTimeWindow().slackMinutes(stop.getArrivalTime());
                if (slack < tightWindowSlackMinutes) {
                    violations.add(warning(CONSTRAINT_TIGHT_WINDOW, String.format(
                            "Stop %s arrives %.1f min before its window closes", stop.getDestinationId(), slack),
                            stop.getDestinationId()));
                }
            }
        }
        if (Math.abs(stopDistance - route.getTotalDistanceKm()) > DISTANCE_TOLERANCE * Math.max(1.0d, stopDistance)) {
            violations.add(error(CONSTRAINT_DISTANCE_TOTAL, String.format(
                    "Route distance %.4f km does not match stop distances %.4f km",
                    route.getTotalDistanceKm(), stopDistance), null));
        }
        if (!arrivals.contains(null) && !TimeUtils.validateFIFO(arrivals)) {
            violations.add(error(CONSTRAINT_ARRIVAL_ORDER, "Stop arrivals are not in non-decreasing order", null));
        }
        if (vehicle != null) {
            checkCapacity(violations, CONSTRAINT_WEIGHT_CAPACITY, "weight", route.totalWeightKg(), vehicle.getCapacityKg(), "kg");
            checkCapacity(violations, CONSTRAINT_VOLUME_CAPACITY, "volume", route.totalVolumeM3(), vehicle.getVolumeCapacityM3(), "m3");
        }

        ValidationResult.ValidationResultBuilder result = ValidationResult.builder().violations(violations);
        int errors = 0;
        int warnings = 0;
        for (ConstraintViolation violation : violations) {
            if (violation.severity() == ViolationSeverity.ERROR) {
                result.error(violation.message());
                errors++;
            } else {
                result.warning(violation.message());
                warnings++;
            }
        }
        return result
                .valid(errors == 0)
                .feasibilityScore(1.0d - Math.min(1.0d, ERROR_WEIGHT * errors + WARNING_WEIGHT * warnings))
                .build();
    }

    private void checkCapacity(
            List<ConstraintViolation> violations,
            String constraint,
            String label,
            double load,
            double capacity,
            String unit
    ) {
        if (load > capacity) {
            violations.add(error(constraint, String.format(
                    "Route %s %.2f %s exceeds vehicle capacity %.2f %s", label, load, unit, capacity, unit), null));
        } else if (capacity > 0.0d && load >= capacity * nearCapacityRatio) {
            violations.add(warning(CONSTRAINT_NEAR_CAPACITY, String.format(
                    "Route %s %.2f %s uses %.0f%% of vehicle capacity", label, load, unit, load / capacity * 100.0d), null));
        }
    }

    private static ConstraintViolation error(String constraint, String message, String destinationId) {
        return new ConstraintViolation(constraint, ViolationSeverity.ERROR, message, destinationId);
    }

    private static ConstraintViolation warning(String constraint, String message, String destinationId) {
        return new ConstraintViolation(constraint, ViolationSeverity.WARNING, message, destinationId);
    }
}
