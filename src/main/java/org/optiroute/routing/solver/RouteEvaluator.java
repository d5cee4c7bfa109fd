package org.optiroute.routing.solver;

import org.optiroute.core.geo.GeoDistance;
import org.optiroute.core.time.TimeUtils;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.TimeWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replays stop orders against one {@link RoutingProblem}.
 *
 * <p>The open route leaves the origin at the departure time, waits for windows that have not
 * opened, serves each stop, and ends at the last stop's departure. Lateness is soft.</p>
 */
public final class RouteEvaluator {
    private static final double LIMIT_EPSILON = 1e-9d;

    private final RoutingProblem problem;
    private final double[] windowStartMinutes;
    private final double[] windowEndMinutes;
    private final double[] serviceMinutes;

    /**
     * Order replay result.
     */
    public record Evaluation(double distanceKm, double durationMinutes, double latenessMinutes, int lateStops) {
    }

    RouteEvaluator(RoutingProblem problem) {
        this.problem = problem;
        int size = problem.size();
        this.windowStartMinutes = new double[size];
        this.windowEndMinutes = new double[size];
        this.serviceMinutes = new double[size];
        Instant departure = problem.departureTime();
        for (int i = 0; i < size; i++) {
            Destination destination = problem.stop(i);
            TimeWindow window = destination.getTimeWindow();
            if (window == null) {
                windowStartMinutes[i] = Double.NEGATIVE_INFINITY;
                windowEndMinutes[i] = Double.POSITIVE_INFINITY;
            } else {
                windowStartMinutes[i] = TimeUtils.minutesBetween(departure, window.start());
                windowEndMinutes[i] = TimeUtils.minutesBetween(departure, window.end());
            }
            serviceMinutes[i] = Math.max(0.0d, destination.getServiceTimeMinutes());
        }
    }

    /**
     * Replays one stop order without materializing stops.
     */
    public Evaluation evaluate(int[] order) {
        TravelTimeModel travel = problem.travelTimeModel();
        double distance = 0.0d;
        double clock = 0.0d;
        double lateness = 0.0d;
        int lateStops = 0;
        int previousNode = 0;
        for (int stop : order) {
            double leg = problem.nodeDistanceKm(previousNode, stop + 1);
            distance += leg;
            double arrival = clock + travel.travelMinutes(leg);
            double late = Math.max(0.0d, arrival - windowEndMinutes[stop]);
            if (late > 0.0d) {
                lateness += late;
                lateStops++;
            }
            double serviceStart = Math.max(arrival, windowStartMinutes[stop]);
            clock = serviceStart + serviceMinutes[stop];
            previousNode = stop + 1;
        }
        return new Evaluation(distance, clock, lateness, lateStops);
    }

    /**
     * Search objective: distance plus weighted lateness.
     */
    public double objective(int[] order) {
        Evaluation evaluation = evaluate(order);
        return evaluation.distanceKm() + problem.settings().getLatenessWeightPerMinute() * evaluation.latenessMinutes();
    }

    /**
     * Returns true when a replayed order breaches max distance or max duration.
     */
    public boolean breachesLimits(Evaluation evaluation) {
        return evaluation.distanceKm() > problem.constraints().getMaxDistanceKm() + LIMIT_EPSILON
                || evaluation.durationMinutes() > problem.constraints().getMaxRouteDurationMinutes() + LIMIT_EPSILON;
    }

    /**
     * Replays an order and fails when it breaches hard limits.
     *
     * @throws SolverException with {@link SolverException#REASON_INFEASIBLE} on a breach.
     */
    public CandidateRoute buildFeasible(SolverAlgorithm algorithm, int[] order) {
        Evaluation evaluation = evaluate(order);
        if (breachesLimits(evaluation)) {
            throw SolverException.infeasible(
                    algorithm,
                    String.format(
                            "tour of %.2f km / %.1f min breaches limits %.2f km / %.1f min",
                            evaluation.distanceKm(),
                            evaluation.durationMinutes(),
                            problem.constraints().getMaxDistanceKm(),
                            problem.constraints().getMaxRouteDurationMinutes()
                    )
            );
        }
        return build(algorithm, order, List.of());
    }

    /**
     * Materializes a candidate route from a stop order.
     *
     * @param algorithm producing algorithm.
     * @param order visited stops in visit order.
     * @param skippedDestinationIds ids the solver left out in addition to capacity-unassigned ones.
     */
    public CandidateRoute build(SolverAlgorithm algorithm, int[] order, List<String> skippedDestinationIds) {
        Objects.requireNonNull(algorithm, "algorithm");
        TravelTimeModel travel = problem.travelTimeModel();
        Instant departure = problem.departureTime();

        CandidateRoute.CandidateRouteBuilder route = CandidateRoute.builder()
                .algorithm(algorithm)
                .departureTime(departure);

        double distance = 0.0d;
        double clock = 0.0d;
        int onTime = 0;
        int previousNode = 0;
        for (int stop : order) {
            Destination destination = problem.stop(stop);
            double leg = problem.nodeDistanceKm(previousNode, stop + 1);
            double travelMinutes = travel.travelMinutes(leg);
            double arrival = clock + travelMinutes;
            double waiting = Math.max(0.0d, windowStartMinutes[stop] - arrival);
            double late = Math.max(0.0d, arrival - windowEndMinutes[stop]);
            double departureOffset = arrival + waiting + serviceMinutes[stop];
            if (late == 0.0d) {
                onTime++;
            }
            route.stop(Stop.builder()
                    .destinationId(destination.getId())
                    .location(destination.getLocation())
                    .priority(destination.effectivePriority())
                    .timeWindow(destination.getTimeWindow())
                    .arrivalTime(TimeUtils.plusMinutes(departure, arrival))
                    .departureTime(TimeUtils.plusMinutes(departure, departureOffset))
                    .serviceTimeMinutes(serviceMinutes[stop])
                    .waitingMinutes(waiting)
                    .latenessMinutes(late)
                    .distanceFromPreviousKm(leg)
                    .travelMinutes(travelMinutes)
                    .weightKg(destination.getWeightKg())
                    .volumeM3(destination.getVolumeM3())
                    .build());
            distance += leg;
            clock = departureOffset;
            previousNode = stop + 1;
        }

        List<String> unassigned = new ArrayList<>(problem.unassignedDestinationIds());
        if (skippedDestinationIds != null) {
            unassigned.addAll(skippedDestinationIds);
        }
        int requested = order.length + unassigned.size();

        return route
                .totalDistanceKm(distance)
                .totalDurationMinutes(clock)
                .efficiency(efficiency(order, distance))
                .feasibility(requested == 0 ? 1.0d : (double) onTime / requested)
                .timeSavingsMinutes(Math.max(0.0d, evaluate(requestOrderOf(order)).durationMinutes() - clock))
                .unassignedDestinationIds(unassigned)
                .build();
    }

    /**
     * Re-times an existing route under a different travel-time model.
     *
     * <p>Stop order and distances are kept; arrival, waiting, lateness and departure are
     * recomputed. The input route is not modified.</p>
     */
    public static CandidateRoute retime(CandidateRoute route, TravelTimeModel travel) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(travel, "travel");
        Instant departure = route.getDepartureTime();
        List<Stop> retimed = new ArrayList<>(route.getStops().size());
        double clock = 0.0d;
        int onTime = 0;
        for (Stop stop : route.getStops()) {
            double travelMinutes = travel.travelMinutes(stop.getDistanceFromPreviousKm());
            double arrival = clock + travelMinutes;
            Instant arrivalTime = TimeUtils.plusMinutes(departure, arrival);
            TimeWindow window = stop.getTimeWindow();
            double waiting = window == null ? 0.0d : window.waitingMinutes(arrivalTime);
            double late = window == null ? 0.0d : window.latenessMinutes(arrivalTime);
            double departureOffset = arrival + waiting + stop.getServiceTimeMinutes();
            if (late == 0.0d) {
                onTime++;
            }
            retimed.add(stop.toBuilder()
                    .arrivalTime(arrivalTime)
                    .departureTime(TimeUtils.plusMinutes(departure, departureOffset))
                    .travelMinutes(travelMinutes)
                    .waitingMinutes(waiting)
                    .latenessMinutes(late)
                    .incrementalCost(0.0d)
                    .build());
            clock = departureOffset;
        }
        int requested = retimed.size() + route.getUnassignedDestinationIds().size();
        return route.toBuilder()
                .clearStops()
                .stops(retimed)
                .totalDurationMinutes(clock)
                .feasibility(requested == 0 ? 1.0d : (double) onTime / requested)
                .build();
    }

    private double efficiency(int[] order, double distance) {
        if (order.length == 0 || distance <= 0.0d) {
            return 1.0d;
        }
        double lowerBound = 0.0d;
        for (int stop : order) {
            double cheapestInbound = problem.originDistanceKm(stop);
            for (int other : order) {
                if (other != stop) {
                    cheapestInbound = Math.min(cheapestInbound, problem.distanceKm(other, stop));
                }
            }
            lowerBound += cheapestInbound;
        }
        return GeoDistance.clamp(lowerBound / distance, 0.0d, 1.0d);
    }

    private int[] requestOrderOf(int[] order) {
        boolean[] visited = new boolean[problem.size()];
        for (int stop : order) {
            visited[stop] = true;
        }
        int[] baseline = new int[order.length];
        int cursor = 0;
        for (int stop = 0; stop < visited.length; stop++) {
            if (visited[stop]) {
                baseline[cursor++] = stop;
            }
        }
        return baseline;
    }
}
