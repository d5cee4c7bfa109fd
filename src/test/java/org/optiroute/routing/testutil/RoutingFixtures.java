package org.optiroute.routing.testutil;

import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.TimeFactors;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.Origin;
import org.optiroute.routing.model.Priority;
import org.optiroute.routing.model.TimeWindow;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.SolverAlgorithm;
import org.optiroute.routing.solver.Stop;

import java.time.Instant;

/**
 * Shared request and context fixtures.
 */
public final class RoutingFixtures {
    /** Tuesday, outside rush hour in UTC. */
    public static final Instant DEPARTURE = Instant.parse("2024-03-12T10:00:00Z");
    public static final GeoPoint LOWER_MANHATTAN = GeoPoint.of(40.7128, -74.0060);
    public static final GeoPoint TIMES_SQUARE = GeoPoint.of(40.7589, -73.9851);

    private RoutingFixtures() {
    }

    public static VehicleProfile van() {
        return VehicleProfile.builder()
                .id("van-1")
                .capacityKg(1000.0d)
                .volumeCapacityM3(10.0d)
                .fuelType(FuelType.DIESEL)
                .currentLocation(LOWER_MANHATTAN)
                .driverId("driver-1")
                .build();
    }

    public static Origin depot() {
        return Origin.builder().location(LOWER_MANHATTAN).address("Lower Manhattan depot").build();
    }

    public static Destination destination(String id, double latitude, double longitude) {
        return Destination.builder()
                .id(id)
                .location(GeoPoint.of(latitude, longitude))
                .priority(Priority.MEDIUM)
                .serviceTimeMinutes(5.0d)
                .weightKg(50.0d)
                .volumeM3(0.5d)
                .build();
    }

    /**
     * The single-stop Manhattan request.
     */
    public static OptimizationRequest singleStopRequest() {
        return OptimizationRequest.builder()
                .requestId("nyc-1")
                .origin(depot())
                .destination(destination("times-square", TIMES_SQUARE.latitude(), TIMES_SQUARE.longitude()))
                .vehicle(van())
                .departureTime(DEPARTURE)
                .build();
    }

    /**
     * Six stops spread around New York City.
     */
    public static OptimizationRequest cityRequest() {
        return OptimizationRequest.builder()
                .requestId("nyc-6")
                .origin(depot())
                .destination(destination("times-square", 40.7589, -73.9851))
                .destination(destination("brooklyn", 40.6782, -73.9442))
                .destination(destination("queens", 40.7282, -73.7949))
                .destination(destination("harlem", 40.8116, -73.9465))
                .destination(destination("jersey-city", 40.7178, -74.0431))
                .destination(destination("bronx", 40.8448, -73.8648))
                .vehicle(van())
                .departureTime(DEPARTURE)
                .build();
    }

    /**
     * Default conditions with a neutral time multiplier.
     */
    public static RealTimeContext neutralContext() {
        return RealTimeContext.builder()
                .traffic(ContextDefaults.traffic())
                .weather(ContextDefaults.weather())
                .fuelPrices(ContextDefaults.fuelPrices("test"))
                .timeFactors(TimeFactors.neutral())
                .capturedAt(DEPARTURE)
                .build();
    }

    /**
     * A hand-built 15 km, 33 minute route whose second stop arrives 3 minutes after its window.
     */
    public static CandidateRoute twoStopRoute() {
        Stop first = Stop.builder()
                .destinationId("a")
                .location(TIMES_SQUARE)
                .priority(Priority.MEDIUM)
                .arrivalTime(DEPARTURE.plusSeconds(15 * 60))
                .departureTime(DEPARTURE.plusSeconds(20 * 60))
                .serviceTimeMinutes(5.0d)
                .distanceFromPreviousKm(10.0d)
                .travelMinutes(15.0d)
                .weightKg(50.0d)
                .volumeM3(0.5d)
                .build();
        Stop second = Stop.builder()
                .destinationId("b")
                .location(GeoPoint.of(40.7484, -73.9857))
                .priority(Priority.HIGH)
                .timeWindow(TimeWindow.of(DEPARTURE, DEPARTURE.plusSeconds(25 * 60)))
                .arrivalTime(DEPARTURE.plusSeconds(28 * 60))
                .departureTime(DEPARTURE.plusSeconds(33 * 60))
                .serviceTimeMinutes(5.0d)
                .latenessMinutes(3.0d)
                .distanceFromPreviousKm(5.0d)
                .travelMinutes(8.0d)
                .weightKg(50.0d)
                .volumeM3(0.5d)
                .build();
        return CandidateRoute.builder()
                .algorithm(SolverAlgorithm.NEAREST_NEIGHBOR)
                .departureTime(DEPARTURE)
                .stop(first)
                .stop(second)
                .totalDistanceKm(15.0d)
                .totalDurationMinutes(33.0d)
                .efficiency(0.9d)
                .feasibility(0.5d)
                .build();
    }
}
