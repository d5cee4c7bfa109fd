package org.optiroute.routing.scoring;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Metric a route comparison is judged on.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum ComparisonCriterion {
    COST("cost", false, ComparableRoute::rankingCost),
    DURATION("duration", false, ComparableRoute::rankingDurationHours),
    DISTANCE("distance", false, ComparableRoute::distanceKm),
    CO2("co2", false, ComparableRoute::rankingCo2Kg),
    EFFICIENCY("efficiency", true, ComparableRoute::efficiency),
    FEASIBILITY("feasibility", true, ComparableRoute::feasibility),
    ENVIRONMENTAL_SCORE("environmental_score", true, ComparableRoute::environmentalScore);

    private final String id;
    /** True when larger values are better. */
    private final boolean higherIsBetter;
    @Getter(AccessLevel.NONE)
    private final ToDoubleFunction<ComparableRoute> extractor;

    /**
     * Raw metric value of a route.
     */
    public double valueOf(ComparableRoute route) {
        return extractor.applyAsDouble(route);
    }

    /**
     * Resolves a criterion from its id or enum name.
     *
     * @throws ScoringException when no criterion matches.
     */
    public static ComparisonCriterion fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (ComparisonCriterion criterion : values()) {
                if (criterion.id.equals(normalized) || criterion.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return criterion;
                }
            }
        }
        throw new ScoringException(ScoringException.REASON_UNKNOWN_CRITERION, "unknown comparison criterion: " + id);
    }
}
