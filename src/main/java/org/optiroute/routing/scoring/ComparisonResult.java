package org.optiroute.routing.scoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Side-by-side comparison of routes over a set of criteria.
 */
@Value
@Builder
public class ComparisonResult {
    String bestRouteId;
    /** Mean normalized criterion score of the best route, in {@code [0, 1]}. */
    double bestScore;
    @Singular
    List<String> reasons;
    @Singular("criterionComparison")
    List<CriterionComparison> detailedComparison;

    /**
     * Per-criterion normalized scores, keyed by route id in input order.
     */
    @Value
    @Builder
    public static class CriterionComparison {
        ComparisonCriterion criterion;
        @Singular
        Map<String, Double> scores;
        String winner;
    }
}
