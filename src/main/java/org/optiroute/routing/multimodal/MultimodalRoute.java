package org.optiroute.routing.multimodal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import org.optiroute.routing.scoring.Rankable;

import java.util.List;
import java.util.Objects;

/**
 * Ordered leg sequence produced from one template.
 */
@Value
@Builder(toBuilder = true)
public class MultimodalRoute implements Rankable {
    String templateId;
    String description;
    @Singular
    List<TransportLeg> legs;
    double totalCost;
    double totalDurationHours;
    double totalCo2Kg;
    double totalDistanceKm;
    /** Weighted rank score; {@code null} until the route is ranked. */
    @With
    Double rankScore;

    /**
     * Builds a route from legs, validating chaining and deriving totals.
     *
     * @throws MultimodalException when legs are empty, not sequenced {@code 1..n}, or not chained.
     */
    public static MultimodalRoute of(String templateId, String description, List<TransportLeg> legs) {
        Objects.requireNonNull(templateId, "templateId");
        validateChain(legs);
        double cost = 0.0d;
        double duration = 0.0d;
        double co2 = 0.0d;
        double distance = 0.0d;
        for (TransportLeg leg : legs) {
            cost += leg.getCost();
            duration += leg.getDurationHours();
            co2 += leg.getCo2Kg();
            distance += leg.getDistanceKm();
        }
        return MultimodalRoute.builder()
                .templateId(templateId)
                .description(description)
                .legs(legs)
                .totalCost(cost)
                .totalDurationHours(duration)
                .totalCo2Kg(co2)
                .totalDistanceKm(distance)
                .build();
    }

    /**
     * Validates leg sequencing and chaining.
     *
     * @throws MultimodalException on a violation.
     */
    public static void validateChain(List<TransportLeg> legs) {
        if (legs == null || legs.isEmpty()) {
            throw new MultimodalException(MultimodalException.REASON_BAD_SEQUENCE, "route must contain at least one leg");
        }
        for (int i = 0; i < legs.size(); i++) {
            TransportLeg leg = legs.get(i);
            if (leg.getSequence() != i + 1) {
                throw new MultimodalException(
                        MultimodalException.REASON_BAD_SEQUENCE,
                        "leg at position " + i + " has sequence " + leg.getSequence() + ", expected " + (i + 1)
                );
            }
            if (i > 0 && !legs.get(i - 1).getDestination().id().equals(leg.getOrigin().id())) {
                throw new MultimodalException(
                        MultimodalException.REASON_BROKEN_CHAIN,
                        "leg " + leg.getSequence() + " starts at " + leg.getOrigin().id()
                                + " but previous leg ends at " + legs.get(i - 1).getDestination().id()
                );
            }
        }
    }

    /**
     * Returns true when any leg uses {@code mode}.
     */
    public boolean usesMode(TransportMode mode) {
        for (TransportLeg leg : legs) {
            if (leg.getMode() == mode) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true when any leg books {@code serviceType}.
     */
    public boolean usesService(ServiceType serviceType) {
        for (TransportLeg leg : legs) {
            if (leg.getServiceType() == serviceType) {
                return true;
            }
        }
        return false;
    }

    @Override
    public double rankingCost() {
        return totalCost;
    }

    @Override
    public double rankingDurationHours() {
        return totalDurationHours;
    }

    @Override
    public double rankingCo2Kg() {
        return totalCo2Kg;
    }
}
