package org.optiroute.routing.multimodal;

import java.util.List;
import java.util.Objects;

/**
 * Fixed leg sequence evaluated for every shipment.
 *
 * @param id stable template id.
 * @param description display text.
 * @param legs legs in planning order.
 * @param transload false when cargo stays on the same trailer across modes.
 */
public record LegTemplate(String id, String description, List<LegSpec> legs, boolean transload) {

    /**
     * One templated leg.
     */
    public record LegSpec(TransportMode mode, LegAnchor from, LegAnchor to) {
        public LegSpec {
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    public LegTemplate {
        Objects.requireNonNull(id, "id");
        legs = List.copyOf(Objects.requireNonNull(legs, "legs"));
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("template " + id + " must define at least one leg");
        }
        if (legs.get(0).from() != LegAnchor.ORIGIN || legs.get(legs.size() - 1).to() != LegAnchor.DESTINATION) {
            throw new IllegalArgumentException("template " + id + " must start at ORIGIN and end at DESTINATION");
        }
        for (int i = 1; i < legs.size(); i++) {
            if (legs.get(i - 1).to() != legs.get(i).from()) {
                throw new IllegalArgumentException("template " + id + " legs are not chained at leg " + (i + 1));
            }
        }
    }

    /**
     * Shorthand for a templated leg.
     */
    public static LegSpec leg(TransportMode mode, LegAnchor from, LegAnchor to) {
        return new LegSpec(mode, from, to);
    }
}
