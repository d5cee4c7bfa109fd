package org.optiroute.routing.multimodal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.scoring.RouteRanker;
import org.optiroute.routing.scoring.ScoringCeilings;
import org.optiroute.routing.scoring.ScoringWeights;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultimodalLegPlannerTest {

    private static final GeoPoint CHICAGO = GeoPoint.of(41.8781, -87.6298);
    private static final GeoPoint NEW_YORK = GeoPoint.of(40.7128, -74.0060);

    private static final List<TransportNode> HUBS = List.of(
            new TransportNode("port-chicago", "Port of Chicago", GeoPoint.of(41.7300, -87.5400), NodeKind.SEAPORT),
            new TransportNode("port-newark", "Port Newark", GeoPoint.of(40.6840, -74.1500), NodeKind.SEAPORT),
            new TransportNode("ord", "O'Hare", GeoPoint.of(41.9742, -87.9073), NodeKind.AIRPORT),
            new TransportNode("jfk", "JFK", GeoPoint.of(40.6413, -73.7781), NodeKind.AIRPORT),
            new TransportNode("rail-chicago", "Chicago intermodal", GeoPoint.of(41.8600, -87.6400), NodeKind.RAIL_TERMINAL),
            new TransportNode("rail-newark", "Newark intermodal", GeoPoint.of(40.7300, -74.1700), NodeKind.RAIL_TERMINAL)
    );

    private static final CargoProfile HEAVY = CargoProfile.builder()
            .weightKg(20_000.0d)
            .volumeM3(70.0d)
            .description("machinery")
            .build();

    private final MultimodalLegPlanner planner = new MultimodalLegPlanner(
            new StaticHubDirectory(HUBS), LegTemplateCatalog.defaultCatalog(), MultimodalConfig.defaults());

    @Test
    @DisplayName("Every applicable template yields one chained route")
    void testOneRoutePerTemplate() {
        List<MultimodalRoute> routes = planner.planRoutes(CHICAGO, NEW_YORK, HEAVY);

        assertEquals(List.of(
                LegTemplateCatalog.TEMPLATE_ROAD_DIRECT,
                LegTemplateCatalog.TEMPLATE_SEA_FREIGHT,
                LegTemplateCatalog.TEMPLATE_AIR_FREIGHT,
                LegTemplateCatalog.TEMPLATE_ROAD_SEA,
                LegTemplateCatalog.TEMPLATE_RAIL_FREIGHT
        ), templateIds(routes));
        for (MultimodalRoute route : routes) {
            assertDoesNotThrow(() -> MultimodalRoute.validateChain(route.getLegs()));
            assertEquals(MultimodalLegPlanner.ORIGIN_NODE_ID, route.getLegs().get(0).getOrigin().id());
            assertEquals(MultimodalLegPlanner.DESTINATION_NODE_ID,
                    route.getLegs().get(route.getLegs().size() - 1).getDestination().id());
            double cost = 0.0d;
            for (TransportLeg leg : route.getLegs()) {
                assertTrue(leg.getDistanceKm() > 0.0d);
                cost += leg.getCost();
            }
            assertEquals(route.getTotalCost(), cost, 1e-9);
            assertNull(route.getRankScore());
        }
    }

    @Test
    @DisplayName("Heavy bulky cargo under cost priority ranks container and truck services above air")
    void testCostPriorityRanking() {
        RouteRanker ranker = new RouteRanker(ScoringCeilings.defaults());

        List<MultimodalRoute> ranked = ranker.rankMultimodal(
                planner.planRoutes(CHICAGO, NEW_YORK, HEAVY), ScoringWeights.of(1.0d, 0.0d, 0.0d));

        MultimodalRoute best = ranked.get(0);
        assertTrue(best.usesService(ServiceType.FCL) || best.usesService(ServiceType.FTL));
        assertFalse(best.usesMode(TransportMode.AIR));
        MultimodalRoute last = ranked.get(ranked.size() - 1);
        assertEquals(LegTemplateCatalog.TEMPLATE_AIR_FREIGHT, last.getTemplateId());
        assertTrue(last.usesService(ServiceType.ECONOMY));
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).getRankScore() >= ranked.get(i).getRankScore());
        }
    }

    @Test
    @DisplayName("Through-trailer template pays half the terminal handling of its transload twin")
    void testThroughTrailerHandling() {
        List<MultimodalRoute> routes = planner.planRoutes(CHICAGO, NEW_YORK, HEAVY);
        MultimodalRoute seaFreight = find(routes, LegTemplateCatalog.TEMPLATE_SEA_FREIGHT);
        MultimodalRoute roadSea = find(routes, LegTemplateCatalog.TEMPLATE_ROAD_SEA);

        double handling = MultimodalConfig.defaults().handlingCost(TransportMode.SEA);
        assertEquals(seaFreight.getTotalCost() - handling / 2.0d, roadSea.getTotalCost(), 1e-6);
        assertEquals(seaFreight.getTotalDistanceKm(), roadSea.getTotalDistanceKm(), 1e-9);
    }

    @Test
    @DisplayName("Cargo above the air ceiling skips air templates")
    void testAirWeightCeiling() {
        CargoProfile oversized = CargoProfile.builder().weightKg(150_000.0d).volumeM3(200.0d).build();

        List<MultimodalRoute> routes = planner.planRoutes(CHICAGO, NEW_YORK, oversized);

        for (MultimodalRoute route : routes) {
            assertFalse(route.usesMode(TransportMode.AIR), route.getTemplateId());
        }
        assertTrue(templateIds(routes).contains(LegTemplateCatalog.TEMPLATE_ROAD_DIRECT));
    }

    @Test
    @DisplayName("Sea/air hub near the midpoint chains ocean and air legs")
    void testSeaAirTemplate() {
        List<TransportNode> hubs = new ArrayList<>(HUBS);
        hubs.add(new TransportNode("hub-cleveland", "Cleveland sea/air hub", GeoPoint.of(41.4993, -81.6944), NodeKind.SEA_AIR_HUB));
        MultimodalLegPlanner seaAir = new MultimodalLegPlanner(
                new StaticHubDirectory(hubs), LegTemplateCatalog.defaultCatalog(), MultimodalConfig.defaults());

        List<MultimodalRoute> routes = seaAir.planRoutes(CHICAGO, NEW_YORK, HEAVY);

        assertEquals(List.of(
                LegTemplateCatalog.TEMPLATE_ROAD_DIRECT,
                LegTemplateCatalog.TEMPLATE_SEA_FREIGHT,
                LegTemplateCatalog.TEMPLATE_AIR_FREIGHT,
                LegTemplateCatalog.TEMPLATE_SEA_AIR,
                LegTemplateCatalog.TEMPLATE_ROAD_SEA,
                LegTemplateCatalog.TEMPLATE_RAIL_FREIGHT
        ), templateIds(routes));
        List<TransportLeg> legs = find(routes, LegTemplateCatalog.TEMPLATE_SEA_AIR).getLegs();
        assertDoesNotThrow(() -> MultimodalRoute.validateChain(legs));
        assertEquals(4, legs.size());
        List<TransportMode> modes = List.of(TransportMode.ROAD, TransportMode.SEA, TransportMode.AIR, TransportMode.ROAD);
        List<String> stops = List.of(MultimodalLegPlanner.ORIGIN_NODE_ID, "port-chicago", "hub-cleveland", "jfk",
                MultimodalLegPlanner.DESTINATION_NODE_ID);
        for (int i = 0; i < legs.size(); i++) {
            TransportLeg leg = legs.get(i);
            assertEquals(i + 1, leg.getSequence());
            assertEquals(modes.get(i), leg.getMode());
            assertEquals(stops.get(i), leg.getOrigin().id());
            assertEquals(stops.get(i + 1), leg.getDestination().id());
        }
        assertEquals(ServiceType.FCL, legs.get(1).getServiceType());
        assertEquals(ServiceType.ECONOMY, legs.get(2).getServiceType());

        CargoProfile oversized = CargoProfile.builder().weightKg(150_000.0d).volumeM3(200.0d).build();
        List<String> heavyIds = templateIds(seaAir.planRoutes(CHICAGO, NEW_YORK, oversized));
        assertFalse(heavyIds.contains(LegTemplateCatalog.TEMPLATE_SEA_AIR));
        assertTrue(heavyIds.contains(LegTemplateCatalog.TEMPLATE_SEA_FREIGHT));
    }

    @Test
    @DisplayName("Without hubs only the direct road haul applies")
    void testNoHubs() {
        MultimodalLegPlanner bare = new MultimodalLegPlanner(
                new StaticHubDirectory(List.of()), LegTemplateCatalog.defaultCatalog(), MultimodalConfig.defaults());

        List<MultimodalRoute> routes = bare.planRoutes(CHICAGO, NEW_YORK, HEAVY);

        assertEquals(List.of(LegTemplateCatalog.TEMPLATE_ROAD_DIRECT), templateIds(routes));
        assertEquals(1, routes.get(0).getLegs().size());
        assertEquals(ServiceType.FTL, routes.get(0).getLegs().get(0).getServiceType());
    }

    @Test
    @DisplayName("Line-haul leg starting and ending at the same hub is skipped")
    void testSameHubSkipped() {
        GeoPoint jerseyCity = GeoPoint.of(40.7178, -74.0431);
        GeoPoint newark = GeoPoint.of(40.7357, -74.1724);
        MultimodalLegPlanner local = new MultimodalLegPlanner(
                new StaticHubDirectory(List.of(HUBS.get(1))), LegTemplateCatalog.defaultCatalog(), MultimodalConfig.defaults());

        List<MultimodalRoute> routes = local.planRoutes(jerseyCity, newark, HEAVY);

        assertEquals(List.of(LegTemplateCatalog.TEMPLATE_ROAD_DIRECT), templateIds(routes));
    }

    @Test
    @DisplayName("Catalog without an applicable template fails")
    void testNoApplicableTemplate() {
        LegTemplateCatalog seaOnly = new LegTemplateCatalog(
                List.of(LegTemplateCatalog.defaultCatalog().template(LegTemplateCatalog.TEMPLATE_SEA_FREIGHT)), false);
        MultimodalLegPlanner seaPlanner = new MultimodalLegPlanner(
                new StaticHubDirectory(List.of()), seaOnly, MultimodalConfig.defaults());

        MultimodalException ex = assertThrows(MultimodalException.class,
                () -> seaPlanner.planRoutes(CHICAGO, NEW_YORK, HEAVY));
        assertEquals(MultimodalException.REASON_NO_TEMPLATE, ex.getReasonCode());
    }

    @Test
    @DisplayName("Invalid endpoints and empty cargo are rejected")
    void testInputValidation() {
        MultimodalException same = assertThrows(MultimodalException.class,
                () -> planner.planRoutes(CHICAGO, CHICAGO, HEAVY));
        assertEquals(MultimodalException.REASON_INVALID_LOCATION, same.getReasonCode());

        MultimodalException invalid = assertThrows(MultimodalException.class,
                () -> planner.planRoutes(GeoPoint.of(91.0d, 0.0d), NEW_YORK, HEAVY));
        assertEquals(MultimodalException.REASON_INVALID_LOCATION, invalid.getReasonCode());

        CargoProfile empty = CargoProfile.builder().weightKg(0.0d).volumeM3(0.0d).build();
        MultimodalException cargo = assertThrows(MultimodalException.class,
                () -> planner.planRoutes(CHICAGO, NEW_YORK, empty));
        assertEquals(MultimodalException.REASON_INVALID_CARGO, cargo.getReasonCode());

        MultimodalException missing = assertThrows(MultimodalException.class,
                () -> planner.planRoutes(CHICAGO, NEW_YORK, null));
        assertEquals(MultimodalException.REASON_INVALID_CARGO, missing.getReasonCode());
    }

    @ParameterizedTest
    @CsvSource({
            "ROAD, 20000, 70, FTL",
            "ROAD, 500, 2, LTL",
            "ROAD, 800, 45, FTL",
            "RAIL, 20, 70, FCL",
            "SEA, 1000, 5, LCL",
            "AIR, 400, 1, EXPRESS",
            "AIR, 600, 1, ECONOMY"
    })
    @DisplayName("Service type follows mode and cargo thresholds")
    void testServiceType(TransportMode mode, double weightKg, double volumeM3, ServiceType expected) {
        CargoProfile cargo = CargoProfile.builder().weightKg(weightKg).volumeM3(volumeM3).build();

        assertEquals(expected, planner.serviceTypeFor(mode, cargo));
    }

    @Test
    @DisplayName("Unchained and mis-sequenced legs are rejected")
    void testChainValidation() {
        TransportNode a = TransportNode.address("a", CHICAGO);
        TransportNode b = TransportNode.address("b", NEW_YORK);
        TransportLeg first = TransportLeg.builder().sequence(1).mode(TransportMode.ROAD).origin(a).destination(b).build();
        TransportLeg broken = first.toBuilder().sequence(2).origin(a).destination(b).build();
        TransportLeg skipped = first.toBuilder().sequence(3).origin(b).destination(a).build();

        MultimodalException chain = assertThrows(MultimodalException.class,
                () -> MultimodalRoute.of("t", "t", List.of(first, broken)));
        assertEquals(MultimodalException.REASON_BROKEN_CHAIN, chain.getReasonCode());

        MultimodalException sequence = assertThrows(MultimodalException.class,
                () -> MultimodalRoute.of("t", "t", List.of(first, skipped)));
        assertEquals(MultimodalException.REASON_BAD_SEQUENCE, sequence.getReasonCode());

        assertThrows(MultimodalException.class, () -> MultimodalRoute.of("t", "t", List.of()));
    }

    private static List<String> templateIds(List<MultimodalRoute> routes) {
        List<String> ids = new ArrayList<>(routes.size());
        for (MultimodalRoute route : routes) {
            ids.add(route.getTemplateId());
        }
        return ids;
    }

    private static MultimodalRoute find(List<MultimodalRoute> routes, String templateId) {
        for (MultimodalRoute route : routes) {
            if (route.getTemplateId().equals(templateId)) {
                return route;
            }
        }
        throw new AssertionError("no route for " + templateId);
    }
}
