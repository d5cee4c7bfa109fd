package org.optiroute.routing.multimodal;

import lombok.extern.slf4j.Slf4j;
import org.optiroute.core.geo.GeoDistance;
import org.optiroute.core.geo.GeoPoint;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates every catalog template for one point-to-point shipment.
 *
 * <p>Each applicable template yields exactly one route. A template is skipped when a hub it needs
 * is missing, when a line-haul leg would start and end at the same hub, or when it flies cargo
 * heavier than the air weight ceiling.</p>
 */
@Slf4j
public final class MultimodalLegPlanner {
    public static final String ORIGIN_NODE_ID = "origin";
    public static final String DESTINATION_NODE_ID = "destination";

    private final HubDirectory hubDirectory;
    private final LegTemplateCatalog catalog;
    private final MultimodalConfig config;

    public MultimodalLegPlanner(HubDirectory hubDirectory, LegTemplateCatalog catalog, MultimodalConfig config) {
        this.hubDirectory = Objects.requireNonNull(hubDirectory, "hubDirectory");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Plans one route per applicable template, in catalog order.
     *
     * @param origin shipment origin.
     * @param destination shipment destination.
     * @param cargo cargo profile.
     * @return applicable routes; never empty.
     * @throws MultimodalException on invalid input or when no template applies.
     */
    public List<MultimodalRoute> planRoutes(GeoPoint origin, GeoPoint destination, CargoProfile cargo) {
        validateInput(origin, destination, cargo);
        TransportNode originNode = TransportNode.address(ORIGIN_NODE_ID, origin);
        TransportNode destinationNode = TransportNode.address(DESTINATION_NODE_ID, destination);
        GeoPoint midpoint = GeoDistance.planarMidpoint(origin, destination);

        Map<LegAnchor, Optional<TransportNode>> resolved = new EnumMap<>(LegAnchor.class);
        resolved.put(LegAnchor.ORIGIN, Optional.of(originNode));
        resolved.put(LegAnchor.DESTINATION, Optional.of(destinationNode));

        List<MultimodalRoute> routes = new ArrayList<>();
        for (LegTemplate template : catalog.templates()) {
            List<TransportLeg> legs = planLegs(template, cargo, resolved, origin, destination, midpoint);
            if (legs != null) {
                routes.add(MultimodalRoute.of(template.id(), template.description(), legs));
            }
        }
        if (routes.isEmpty()) {
            throw new MultimodalException(
                    MultimodalException.REASON_NO_TEMPLATE,
                    "no leg template applies to this shipment"
            );
        }
        return List.copyOf(routes);
    }

    /**
     * Service type booked for a leg of {@code mode} carrying {@code cargo}.
     */
    public ServiceType serviceTypeFor(TransportMode mode, CargoProfile cargo) {
        return switch (mode) {
            case ROAD -> cargo.getWeightKg() >= config.getFtlWeightThresholdKg()
                    || cargo.getVolumeM3() >= config.getFtlVolumeThresholdM3()
                    ? ServiceType.FTL
                    : ServiceType.LTL;
            case SEA, RAIL -> cargo.getVolumeM3() > config.getFclVolumeThresholdM3()
                    ? ServiceType.FCL
                    : ServiceType.LCL;
            case AIR -> cargo.getWeightKg() <= config.getExpressWeightLimitKg()
                    ? ServiceType.EXPRESS
                    : ServiceType.ECONOMY;
        };
    }

    private List<TransportLeg> planLegs(
            LegTemplate template,
            CargoProfile cargo,
            Map<LegAnchor, Optional<TransportNode>> resolved,
            GeoPoint origin,
            GeoPoint destination,
            GeoPoint midpoint
    ) {
        double handlingFactor = template.transload() ? 1.0d : config.getThroughTrailerHandlingFactor();
        List<TransportLeg> legs = new ArrayList<>(template.legs().size());
        for (LegTemplate.LegSpec spec : template.legs()) {
            if (spec.mode() == TransportMode.AIR && cargo.getWeightKg() > config.getAirWeightCeilingKg()) {
                log.debug("Skipping template {}: cargo exceeds air weight ceiling", template.id());
                return null;
            }
            Optional<TransportNode> from = resolved.computeIfAbsent(
                    spec.from(), anchor -> lookup(anchor, origin, destination, midpoint));
            Optional<TransportNode> to = resolved.computeIfAbsent(
                    spec.to(), anchor -> lookup(anchor, origin, destination, midpoint));
            if (from.isEmpty() || to.isEmpty()) {
                log.debug("Skipping template {}: no hub for {}", template.id(), from.isEmpty() ? spec.from() : spec.to());
                return null;
            }
            if (spec.mode() != TransportMode.ROAD && from.get().id().equals(to.get().id())) {
                log.debug("Skipping template {}: {} leg starts and ends at {}", template.id(), spec.mode(), from.get().id());
                return null;
            }
            legs.add(buildLeg(legs.size() + 1, spec.mode(), from.get(), to.get(), cargo, handlingFactor));
        }
        return legs;
    }

    private Optional<TransportNode> lookup(LegAnchor anchor, GeoPoint origin, GeoPoint destination, GeoPoint midpoint) {
        GeoPoint from = switch (anchor.side()) {
            case ORIGIN -> origin;
            case DESTINATION -> destination;
            case MIDPOINT -> midpoint;
        };
        return hubDirectory.nearest(anchor.kind(), from);
    }

    private TransportLeg buildLeg(
            int sequence,
            TransportMode mode,
            TransportNode from,
            TransportNode to,
            CargoProfile cargo,
            double handlingFactor
    ) {
        ServiceType serviceType = serviceTypeFor(mode, cargo);
        double distance = GeoDistance.greatCircleDistanceKm(from.location(), to.location()) * config.circuityFactor(mode);
        double rate = config.serviceRate(serviceType);
        if (mode == TransportMode.RAIL) {
            rate *= config.getRailRateFactor();
        }
        double cost = rate * chargeableUnits(serviceType, cargo) * distance + config.handlingCost(mode) * handlingFactor;
        double duration = distance / config.speedKmh(mode) + config.handlingHours(mode) * handlingFactor;
        double co2 = cargo.weightTonnes() * distance * config.emissionFactor(mode);
        return TransportLeg.builder()
                .sequence(sequence)
                .mode(mode)
                .serviceType(serviceType)
                .origin(from)
                .destination(to)
                .carrier(config.carrier(mode))
                .distanceKm(distance)
                .durationHours(duration)
                .cost(cost)
                .co2Kg(co2)
                .build();
    }

    private double chargeableUnits(ServiceType serviceType, CargoProfile cargo) {
        double tonnes = cargo.weightTonnes();
        double volume = cargo.getVolumeM3();
        return switch (serviceType) {
            case FTL -> Math.max(1.0d, Math.ceil(Math.max(
                    cargo.getWeightKg() / config.getTruckPayloadKg(),
                    volume / config.getTruckVolumeM3())));
            case LTL -> Math.max(tonnes, volume * config.getRoadVolumetricKgPerM3() / 1_000.0d);
            case FCL -> Math.max(1.0d, Math.ceil(Math.max(
                    cargo.getWeightKg() / config.getContainerPayloadKg(),
                    volume / config.getContainerVolumeM3())));
            case LCL -> Math.max(tonnes, volume);
            case EXPRESS, ECONOMY -> Math.max(tonnes, volume * config.getAirVolumetricKgPerM3() / 1_000.0d);
        };
    }

    private static void validateInput(GeoPoint origin, GeoPoint destination, CargoProfile cargo) {
        if (origin == null || destination == null || !origin.isValid() || !destination.isValid()) {
            throw new MultimodalException(
                    MultimodalException.REASON_INVALID_LOCATION,
                    "origin and destination must be valid coordinates"
            );
        }
        if (GeoDistance.greatCircleDistanceKm(origin, destination) < 1e-6d) {
            throw new MultimodalException(
                    MultimodalException.REASON_INVALID_LOCATION,
                    "origin and destination must differ"
            );
        }
        if (cargo == null) {
            throw new MultimodalException(MultimodalException.REASON_INVALID_CARGO, "cargo must be provided");
        }
        if (!(cargo.getWeightKg() >= 0.0d) || !(cargo.getVolumeM3() >= 0.0d)
                || !Double.isFinite(cargo.getWeightKg()) || !Double.isFinite(cargo.getVolumeM3())) {
            throw new MultimodalException(
                    MultimodalException.REASON_INVALID_CARGO,
                    "cargo weight and volume must be finite and >= 0"
            );
        }
        if (cargo.getWeightKg() == 0.0d && cargo.getVolumeM3() == 0.0d) {
            throw new MultimodalException(MultimodalException.REASON_INVALID_CARGO, "cargo must have weight or volume");
        }
    }
}
