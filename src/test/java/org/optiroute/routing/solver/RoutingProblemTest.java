package org.optiroute.routing.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.Priority;
import org.optiroute.routing.testutil.RoutingFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingProblemTest {

    @Test
    @DisplayName("Capacity assignment takes high priority first, then request order")
    void testCapacityAssignment() {
        OptimizationRequest request = RoutingFixtures.singleStopRequest().toBuilder()
                .clearDestinations()
                .destination(RoutingFixtures.destination("low", 40.72, -74.00).toBuilder()
                        .priority(Priority.LOW).weightKg(600.0d).build())
                .destination(RoutingFixtures.destination("high", 40.73, -74.00).toBuilder()
                        .priority(Priority.HIGH).weightKg(600.0d).build())
                .destination(RoutingFixtures.destination("medium", 40.74, -74.00).toBuilder()
                        .priority(Priority.MEDIUM).weightKg(400.0d).build())
                .build();

        RoutingProblem problem = RoutingProblem.of(request, RoutingFixtures.neutralContext(), SolverSettings.defaults());

        assertEquals(2, problem.size());
        assertEquals(List.of("low"), problem.unassignedDestinationIds());
        // assigned stops keep request order
        assertEquals("high", problem.stop(0).getId());
        assertEquals("medium", problem.stop(1).getId());
    }

    @Test
    @DisplayName("Equal priorities are assigned in request order")
    void testEqualPriorityKeepsRequestOrder() {
        OptimizationRequest.OptimizationRequestBuilder builder = RoutingFixtures.singleStopRequest().toBuilder()
                .clearDestinations();
        for (int i = 0; i < 5; i++) {
            builder.destination(RoutingFixtures.destination("stop-" + i, 40.72 + i * 0.01d, -74.00).toBuilder()
                    .weightKg(300.0d).build());
        }
        builder.destination(RoutingFixtures.destination("urgent", 40.80, -74.00).toBuilder()
                .priority(Priority.HIGH).weightKg(300.0d).build());

        RoutingProblem problem = RoutingProblem.of(builder.build(), RoutingFixtures.neutralContext(), SolverSettings.defaults());

        assertEquals(3, problem.size());
        assertEquals("stop-0", problem.stop(0).getId());
        assertEquals("stop-1", problem.stop(1).getId());
        assertEquals("urgent", problem.stop(2).getId());
        assertEquals(List.of("stop-2", "stop-3", "stop-4"), problem.unassignedDestinationIds());
    }

    @Test
    @DisplayName("Volume capacity also limits assignment")
    void testVolumeCapacity() {
        Destination bulky = RoutingFixtures.destination("bulky", 40.72, -74.00).toBuilder().volumeM3(11.0d).build();
        OptimizationRequest request = RoutingFixtures.singleStopRequest().toBuilder().destination(bulky).build();

        RoutingProblem problem = RoutingProblem.of(request, RoutingFixtures.neutralContext(), SolverSettings.defaults());

        assertEquals(1, problem.size());
        assertEquals(List.of("bulky"), problem.unassignedDestinationIds());
    }

    @Test
    @DisplayName("Distances are haversine scaled by road circuity")
    void testDistanceMatrix() {
        RoutingProblem problem = RoutingProblem.of(
                RoutingFixtures.singleStopRequest(),
                RoutingFixtures.neutralContext(),
                SolverSettings.defaults()
        );
        double straight = RoutingFixtures.LOWER_MANHATTAN.distanceKmTo(RoutingFixtures.TIMES_SQUARE);

        assertEquals(straight * SolverSettings.DEFAULT_ROAD_CIRCUITY_FACTOR, problem.originDistanceKm(0), 1e-9);
        assertEquals(problem.originDistanceKm(0), problem.nodeDistanceKm(0, 1), 1e-12);
        assertEquals(0.0d, problem.distanceKm(0, 0), 1e-12);
    }

    @Test
    @DisplayName("A departure time is required")
    void testDepartureRequired() {
        OptimizationRequest request = RoutingFixtures.singleStopRequest().toBuilder().departureTime(null).build();
        assertThrows(
                IllegalArgumentException.class,
                () -> RoutingProblem.of(request, RoutingFixtures.neutralContext(), SolverSettings.defaults())
        );
    }
}
