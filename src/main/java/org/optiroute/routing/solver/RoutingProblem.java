package org.optiroute.routing.solver;

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.optiroute.core.geo.GeoDistance;
import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.Origin;
import org.optiroute.routing.model.VehicleProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable solver input shared by every solver of one run.
 *
 * <p>Node {@code 0} of the distance matrix is the origin; node {@code i + 1} is assigned stop
 * {@code i}. Stops are indexed in request order.</p>
 */
public final class RoutingProblem {
    private final Instant departureTime;
    private final Origin origin;
    private final VehicleProfile vehicle;
    private final Constraints constraints;
    private final RealTimeContext context;
    private final SolverSettings settings;

    private final List<Destination> stops;
    private final List<String> unassignedDestinationIds;
    private final double[][] nodeDistanceKm;
    private final TravelTimeModel travelTimeModel;
    private final RouteEvaluator evaluator;

    private RoutingProblem(
            Instant departureTime,
            Origin origin,
            VehicleProfile vehicle,
            Constraints constraints,
            RealTimeContext context,
            SolverSettings settings,
            List<Destination> stops,
            List<String> unassignedDestinationIds
    ) {
        this.departureTime = departureTime;
        this.origin = origin;
        this.vehicle = vehicle;
        this.constraints = constraints;
        this.context = context;
        this.settings = settings;
        this.stops = List.copyOf(stops);
        this.unassignedDestinationIds = List.copyOf(unassignedDestinationIds);

        this.nodeDistanceKm = buildDistanceMatrix(origin.getLocation(), this.stops, settings.getRoadCircuityFactor());
        this.travelTimeModel = TravelTimeModel.from(
                context,
                constraints.isAvoidHighways(),
                settings.getHighwayAvoidanceSpeedFactor()
        );
        this.evaluator = new RouteEvaluator(this);
    }

    /**
     * Builds a problem from a validated request and a context snapshot.
     *
     * <p>Destinations are assigned highest priority first, then in request order, skipping any
     * whose weight or volume no longer fits the vehicle. Skipped destinations are reported as
     * unassigned.</p>
     *
     * @param request validated request carrying a departure time.
     * @param context context snapshot of this run.
     * @param settings solver settings.
     * @return immutable problem.
     */
    public static RoutingProblem of(OptimizationRequest request, RealTimeContext context, SolverSettings settings) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(settings, "settings");
        if (request.getDepartureTime() == null) {
            throw new IllegalArgumentException("request.departureTime must be resolved before building a problem");
        }
        Constraints constraints = request.getConstraints() == null ? Constraints.unbounded() : request.getConstraints();
        VehicleProfile vehicle = Objects.requireNonNull(request.getVehicle(), "request.vehicle");

        List<Destination> destinations = request.getDestinations();
        int[] byPriority = new int[destinations.size()];
        for (int i = 0; i < byPriority.length; i++) {
            byPriority[i] = i;
        }
        // stable: equal priorities keep request order
        IntArrays.mergeSort(byPriority, (a, b) -> Integer.compare(
                destinations.get(a).effectivePriority().ordinal(),
                destinations.get(b).effectivePriority().ordinal()));

        boolean[] accepted = new boolean[destinations.size()];
        double weight = 0.0d;
        double volume = 0.0d;
        for (int index : byPriority) {
            Destination destination = destinations.get(index);
            double nextWeight = weight + destination.getWeightKg();
            double nextVolume = volume + destination.getVolumeM3();
            if (nextWeight <= vehicle.getCapacityKg() && nextVolume <= vehicle.getVolumeCapacityM3()) {
                accepted[index] = true;
                weight = nextWeight;
                volume = nextVolume;
            }
        }

        List<Destination> assigned = new ArrayList<>();
        List<String> unassigned = new ArrayList<>();
        for (int i = 0; i < destinations.size(); i++) {
            if (accepted[i]) {
                assigned.add(destinations.get(i));
            } else {
                unassigned.add(destinations.get(i).getId());
            }
        }
        return new RoutingProblem(
                request.getDepartureTime(),
                request.getOrigin(),
                vehicle,
                constraints,
                context,
                settings,
                assigned,
                unassigned
        );
    }

    /**
     * Number of assigned stops.
     */
    public int size() {
        return stops.size();
    }

    /**
     * Returns assigned stop {@code index}.
     */
    public Destination stop(int index) {
        return stops.get(index);
    }

    /**
     * Road distance between two matrix nodes (0 = origin, i + 1 = stop i).
     */
    public double nodeDistanceKm(int fromNode, int toNode) {
        return nodeDistanceKm[fromNode][toNode];
    }

    /**
     * Road distance from the origin to stop {@code stop}.
     */
    public double originDistanceKm(int stop) {
        return nodeDistanceKm[0][stop + 1];
    }

    /**
     * Road distance between two stops.
     */
    public double distanceKm(int fromStop, int toStop) {
        return nodeDistanceKm[fromStop + 1][toStop + 1];
    }

    /**
     * Returns stops in request order, {@code [0, size)}.
     */
    public int[] requestOrder() {
        int[] order = new int[stops.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        return order;
    }

    public Instant departureTime() {
        return departureTime;
    }

    public Origin origin() {
        return origin;
    }

    public VehicleProfile vehicle() {
        return vehicle;
    }

    public Constraints constraints() {
        return constraints;
    }

    public RealTimeContext context() {
        return context;
    }

    public SolverSettings settings() {
        return settings;
    }

    public List<Destination> stops() {
        return stops;
    }

    /**
     * Destinations left out by capacity-driven assignment, in request order.
     */
    public List<String> unassignedDestinationIds() {
        return unassignedDestinationIds;
    }

    public TravelTimeModel travelTimeModel() {
        return travelTimeModel;
    }

    public RouteEvaluator evaluator() {
        return evaluator;
    }

    private static double[][] buildDistanceMatrix(GeoPoint origin, List<Destination> stops, double circuityFactor) {
        int nodes = stops.size() + 1;
        GeoPoint[] points = new GeoPoint[nodes];
        points[0] = origin;
        for (int i = 0; i < stops.size(); i++) {
            points[i + 1] = stops.get(i).getLocation();
        }
        double[][] matrix = new double[nodes][nodes];
        for (int i = 0; i < nodes; i++) {
            for (int j = i + 1; j < nodes; j++) {
                double distance = GeoDistance.greatCircleDistanceKm(points[i], points[j]) * circuityFactor;
                matrix[i][j] = distance;
                matrix[j][i] = distance;
            }
        }
        return matrix;
    }
}
