package org.optiroute.routing.recommendation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.optiroute.routing.context.ContextSource;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RoadCondition;
import org.optiroute.routing.context.TimeFactors;
import org.optiroute.routing.context.TrafficIncident;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.testutil.RoutingFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator(RecommendationConfig.defaults());

    private static RecommendationInput input(RealTimeContext context) {
        return RecommendationInput.builder()
                .context(context)
                .fuelType(FuelType.DIESEL)
                .selected(RoutingFixtures.twoStopRoute().toBuilder().feasibility(1.0d).build())
                .feasibilityThreshold(0.8d)
                .build();
    }

    @Test
    @DisplayName("Calm conditions produce no recommendations")
    void testCalmConditions() {
        assertTrue(generator.generate(input(RoutingFixtures.neutralContext())).isEmpty());
    }

    @Test
    @DisplayName("Independent rules co-fire in table order")
    void testRulesCoFire() {
        RealTimeContext neutral = RoutingFixtures.neutralContext();
        RealTimeContext rough = neutral.toBuilder()
                .traffic(neutral.getTraffic().toBuilder()
                        .congestionLevel(0.85d)
                        .incident(TrafficIncident.builder()
                                .type(TrafficIncident.Type.ACCIDENT)
                                .severity(TrafficIncident.Severity.HIGH)
                                .location(RoutingFixtures.TIMES_SQUARE)
                                .description("multi-vehicle collision")
                                .estimatedDurationMinutes(45.0d)
                                .build())
                        .build())
                .weather(neutral.getWeather().toBuilder().roadCondition(RoadCondition.ICY).build())
                .fuelPrices(neutral.getFuelPrices().scaled(1.5d))
                .timeFactors(TimeFactors.builder().rushHour(true).trafficMultiplier(1.3d).build())
                .build();

        List<String> recommendations = generator.generate(input(rough));

        assertEquals(5, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("High traffic congestion"));
        assertTrue(recommendations.get(1).startsWith("Hazardous road conditions"));
        assertEquals("High diesel prices: evaluate electric vehicles for this route", recommendations.get(2));
        assertTrue(recommendations.get(3).startsWith("Rush hour departure"));
        assertTrue(recommendations.get(4).startsWith("High-severity traffic incident"));
    }

    @Test
    @DisplayName("Congestion exactly at the threshold does not fire")
    void testCongestionThresholdIsExclusive() {
        RealTimeContext neutral = RoutingFixtures.neutralContext();
        RealTimeContext atThreshold = neutral.toBuilder()
                .traffic(neutral.getTraffic().toBuilder()
                        .congestionLevel(RecommendationConfig.DEFAULT_CONGESTION_THRESHOLD).build())
                .build();

        assertTrue(generator.generate(input(atThreshold)).isEmpty());
    }

    @Test
    @DisplayName("Stale context names the degraded sources")
    void testStaleContext() {
        RealTimeContext stale = RoutingFixtures.neutralContext().toBuilder()
                .stale(true)
                .degradedSource(ContextSource.TRAFFIC)
                .build();

        List<String> recommendations = generator.generate(input(stale));

        assertEquals(List.of("Real-time data unavailable for [TRAFFIC]: results use fallback values"), recommendations);
    }

    @Test
    @DisplayName("Infeasible selection and unassigned stops are reported")
    void testSelectionRules() {
        RecommendationInput weak = RecommendationInput.builder()
                .context(RoutingFixtures.neutralContext())
                .fuelType(FuelType.DIESEL)
                .selected(RoutingFixtures.twoStopRoute().toBuilder()
                        .feasibility(0.5d)
                        .unassignedDestinationId("far-away")
                        .build())
                .feasibilityThreshold(0.8d)
                .build();

        List<String> recommendations = generator.generate(weak);

        assertEquals(2, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("No candidate met the feasibility threshold"));
        assertEquals("1 destination(s) could not be assigned: consider an additional vehicle", recommendations.get(1));
    }

    @Test
    @DisplayName("Custom rules run after built-ins")
    void testCustomRules() {
        RecommendationRule night = RecommendationRule.of("ALWAYS", input -> true, "Custom advice");
        RecommendationGenerator custom = new RecommendationGenerator(RecommendationConfig.defaults(), List.of(night));

        assertEquals(List.of("Custom advice"), custom.generate(input(RoutingFixtures.neutralContext())));
        assertEquals("ALWAYS", custom.rules().get(custom.rules().size() - 1).id());
        assertEquals(RecommendationGenerator.RULE_HIGH_CONGESTION, custom.rules().get(0).id());
    }

    @Test
    @DisplayName("Missing fuel type skips the fuel price rule")
    void testNoFuelType() {
        RealTimeContext expensive = RoutingFixtures.neutralContext().toBuilder()
                .fuelPrices(RoutingFixtures.neutralContext().getFuelPrices().scaled(10.0d))
                .build();
        RecommendationInput input = RecommendationInput.builder()
                .context(expensive)
                .feasibilityThreshold(0.8d)
                .build();

        assertTrue(generator.generate(input).isEmpty());
    }

    @Test
    @DisplayName("Out-of-range thresholds are rejected")
    void testConfigValidation() {
        RecommendationConfig config = RecommendationConfig.builder().congestionThreshold(1.5d).build();

        assertThrows(IllegalArgumentException.class, () -> new RecommendationGenerator(config));
    }
}
