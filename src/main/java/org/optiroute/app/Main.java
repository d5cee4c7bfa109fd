package org.optiroute.app;

import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.context.FuelPrices;
import org.optiroute.routing.context.RealTimeDataProvider;
import org.optiroute.routing.context.Traffic;
import org.optiroute.routing.context.Weather;
import org.optiroute.routing.core.OptimizationOrchestrator;
import org.optiroute.routing.core.OptimizationResult;
import org.optiroute.routing.core.OptimizerConfig;
import org.optiroute.routing.core.RouteOutcome;
import org.optiroute.routing.event.LoggingEventSink;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.Origin;
import org.optiroute.routing.model.Priority;
import org.optiroute.routing.model.VehicleProfile;

import java.io.PrintStream;
import java.time.Instant;
import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    static final Instant SAMPLE_DEPARTURE = Instant.parse("2024-03-12T10:00:00Z");

    /**
     * Runs one in-memory optimization and prints its summary.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        runSample(System.out);
    }

    static OptimizationResult runSample(PrintStream out) {
        OptimizationResult result;
        try (OptimizationOrchestrator orchestrator = OptimizationOrchestrator.builder()
                .config(OptimizerConfig.fromSystemProperties())
                .dataProvider(new DefaultsDataProvider())
                .eventSink(new LoggingEventSink())
                .build()) {
            result = orchestrator.optimizeRoutes(sampleRequest());
        }

        out.printf("request %s: %d route(s)%n", result.getRequestId(), result.getSummary().getTotalRoutes());
        for (RouteOutcome outcome : result.getRoutes()) {
            out.printf(
                    "  %s via %s: %.2f km, %.1f min, cost %.2f, CO2 %.2f kg%n",
                    outcome.getRouteId(),
                    outcome.getCandidate().getAlgorithm().displayName(),
                    outcome.getCandidate().getTotalDistanceKm(),
                    outcome.getCandidate().getTotalDurationMinutes(),
                    outcome.getCost().total(),
                    outcome.getSustainability().getCo2EmissionsKg()
            );
        }
        for (String recommendation : result.getSummary().getRecommendations()) {
            out.println("  - " + recommendation);
        }
        return result;
    }

    static OptimizationRequest sampleRequest() {
        return OptimizationRequest.builder()
                .requestId("sample")
                .origin(Origin.builder().location(GeoPoint.of(40.7128, -74.0060)).address("Lower Manhattan depot").build())
                .destination(Destination.builder()
                        .id("midtown")
                        .location(GeoPoint.of(40.7589, -73.9851))
                        .priority(Priority.HIGH)
                        .serviceTimeMinutes(10.0d)
                        .weightKg(120.0d)
                        .volumeM3(1.5d)
                        .build())
                .destination(Destination.builder()
                        .id("brooklyn")
                        .location(GeoPoint.of(40.6782, -73.9442))
                        .priority(Priority.MEDIUM)
                        .serviceTimeMinutes(15.0d)
                        .weightKg(80.0d)
                        .volumeM3(1.0d)
                        .build())
                .vehicle(VehicleProfile.builder()
                        .id("van-1")
                        .capacityKg(1000.0d)
                        .volumeCapacityM3(10.0d)
                        .fuelType(FuelType.DIESEL)
                        .build())
                .departureTime(SAMPLE_DEPARTURE)
                .build();
    }

    private static final class DefaultsDataProvider implements RealTimeDataProvider {
        @Override
        public Traffic getTraffic(GeoPoint origin, List<GeoPoint> destinations) {
            return ContextDefaults.traffic();
        }

        @Override
        public Weather getWeather(GeoPoint origin, List<GeoPoint> destinations) {
            return ContextDefaults.weather();
        }

        @Override
        public FuelPrices getFuelPrices(String region) {
            return ContextDefaults.fuelPrices(region);
        }
    }
}
