package org.optiroute.routing.multimodal;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.optiroute.routing.multimodal.LegAnchor.DESTINATION;
import static org.optiroute.routing.multimodal.LegAnchor.DESTINATION_AIRPORT;
import static org.optiroute.routing.multimodal.LegAnchor.DESTINATION_RAIL_TERMINAL;
import static org.optiroute.routing.multimodal.LegAnchor.DESTINATION_SEAPORT;
import static org.optiroute.routing.multimodal.LegAnchor.ORIGIN;
import static org.optiroute.routing.multimodal.LegAnchor.ORIGIN_AIRPORT;
import static org.optiroute.routing.multimodal.LegAnchor.ORIGIN_RAIL_TERMINAL;
import static org.optiroute.routing.multimodal.LegAnchor.ORIGIN_SEAPORT;
import static org.optiroute.routing.multimodal.LegAnchor.TRANSSHIPMENT_HUB;
import static org.optiroute.routing.multimodal.LegTemplate.leg;

/**
 * Immutable ordered catalog of leg templates.
 */
public final class LegTemplateCatalog {
    public static final String TEMPLATE_ROAD_DIRECT = "ROAD_DIRECT";
    public static final String TEMPLATE_SEA_FREIGHT = "SEA_FREIGHT";
    public static final String TEMPLATE_AIR_FREIGHT = "AIR_FREIGHT";
    public static final String TEMPLATE_SEA_AIR = "SEA_AIR";
    public static final String TEMPLATE_ROAD_SEA = "ROAD_SEA";
    public static final String TEMPLATE_RAIL_FREIGHT = "RAIL_FREIGHT";

    private static final List<LegTemplate> BUILT_INS = List.of(
            new LegTemplate(TEMPLATE_ROAD_DIRECT, "Direct road haul", List.of(
                    leg(TransportMode.ROAD, ORIGIN, DESTINATION)
            ), false),
            new LegTemplate(TEMPLATE_SEA_FREIGHT, "Road feeder, ocean freight, road delivery", List.of(
                    leg(TransportMode.ROAD, ORIGIN, ORIGIN_SEAPORT),
                    leg(TransportMode.SEA, ORIGIN_SEAPORT, DESTINATION_SEAPORT),
                    leg(TransportMode.ROAD, DESTINATION_SEAPORT, DESTINATION)
            ), true),
            new LegTemplate(TEMPLATE_AIR_FREIGHT, "Road feeder, air freight, road delivery", List.of(
                    leg(TransportMode.ROAD, ORIGIN, ORIGIN_AIRPORT),
                    leg(TransportMode.AIR, ORIGIN_AIRPORT, DESTINATION_AIRPORT),
                    leg(TransportMode.ROAD, DESTINATION_AIRPORT, DESTINATION)
            ), true),
            new LegTemplate(TEMPLATE_SEA_AIR, "Ocean freight to a sea/air hub, then air freight", List.of(
                    leg(TransportMode.ROAD, ORIGIN, ORIGIN_SEAPORT),
                    leg(TransportMode.SEA, ORIGIN_SEAPORT, TRANSSHIPMENT_HUB),
                    leg(TransportMode.AIR, TRANSSHIPMENT_HUB, DESTINATION_AIRPORT),
                    leg(TransportMode.ROAD, DESTINATION_AIRPORT, DESTINATION)
            ), true),
            new LegTemplate(TEMPLATE_ROAD_SEA, "Through-trailer road haul with a ro-ro sea crossing", List.of(
                    leg(TransportMode.ROAD, ORIGIN, ORIGIN_SEAPORT),
                    leg(TransportMode.SEA, ORIGIN_SEAPORT, DESTINATION_SEAPORT),
                    leg(TransportMode.ROAD, DESTINATION_SEAPORT, DESTINATION)
            ), false),
            new LegTemplate(TEMPLATE_RAIL_FREIGHT, "Road feeder, rail freight, road delivery", List.of(
                    leg(TransportMode.ROAD, ORIGIN, ORIGIN_RAIL_TERMINAL),
                    leg(TransportMode.RAIL, ORIGIN_RAIL_TERMINAL, DESTINATION_RAIL_TERMINAL),
                    leg(TransportMode.ROAD, DESTINATION_RAIL_TERMINAL, DESTINATION)
            ), true)
    );

    private final Map<String, LegTemplate> templatesById;

    /**
     * Creates a catalog with built-in templates only.
     */
    public LegTemplateCatalog() {
        this(List.of(), true);
    }

    /**
     * Creates a catalog by merging built-ins with custom templates.
     */
    public LegTemplateCatalog(Collection<LegTemplate> customTemplates) {
        this(customTemplates, true);
    }

    /**
     * Creates an explicit catalog from the given templates.
     */
    public LegTemplateCatalog(Collection<LegTemplate> templates, boolean includeBuiltIns) {
        LinkedHashMap<String, LegTemplate> map = new LinkedHashMap<>();
        if (includeBuiltIns) {
            register(map, BUILT_INS);
        }
        if (templates != null) {
            register(map, templates);
        }
        this.templatesById = Collections.unmodifiableMap(map);
    }

    /**
     * Returns template by id, or null when not registered.
     */
    public LegTemplate template(String templateId) {
        if (templateId == null) {
            return null;
        }
        return templatesById.get(templateId);
    }

    /**
     * Returns registered template ids in evaluation order.
     */
    public Set<String> templateIds() {
        return templatesById.keySet();
    }

    /**
     * Returns templates in evaluation order.
     */
    public Collection<LegTemplate> templates() {
        return templatesById.values();
    }

    /**
     * Returns a new default catalog instance.
     */
    public static LegTemplateCatalog defaultCatalog() {
        return new LegTemplateCatalog();
    }

    private static void register(LinkedHashMap<String, LegTemplate> map, Collection<LegTemplate> templates) {
        for (LegTemplate template : templates) {
            LegTemplate nonNullTemplate = Objects.requireNonNull(template, "template");
            map.put(normalizeRequiredId(nonNullTemplate.id(), "template.id"), nonNullTemplate);
        }
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }
}
