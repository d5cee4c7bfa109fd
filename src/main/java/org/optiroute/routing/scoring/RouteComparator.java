package org.optiroute.routing.scoring;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares routes criterion by criterion.
 *
 * <p>Each criterion maps route values onto {@code [0, 1]} within the compared set (best 1, worst
 * 0, all 1 when equal). The best route has the highest mean score; ties go to the earlier route.</p>
 */
public final class RouteComparator {
    public static final List<ComparisonCriterion> DEFAULT_CRITERIA = List.of(
            ComparisonCriterion.COST,
            ComparisonCriterion.DURATION,
            ComparisonCriterion.CO2
    );

    /**
     * Compares routes.
     *
     * @param routes routes with unique ids.
     * @param criteria criteria to judge on; {@link #DEFAULT_CRITERIA} when null or empty.
     * @throws ScoringException on empty input or duplicate route ids.
     */
    public ComparisonResult compare(List<? extends ComparableRoute> routes, List<ComparisonCriterion> criteria) {
        if (routes == null || routes.isEmpty()) {
            throw new ScoringException(ScoringException.REASON_EMPTY_INPUT, "at least one route is required");
        }
        Set<String> ids = new HashSet<>();
        for (ComparableRoute route : routes) {
            Objects.requireNonNull(route, "route");
            if (!ids.add(route.routeId())) {
                throw new ScoringException(ScoringException.REASON_DUPLICATE_ROUTE_ID, "duplicate route id: " + route.routeId());
            }
        }
        Set<ComparisonCriterion> effective = criteria == null || criteria.isEmpty()
                ? new LinkedHashSet<>(DEFAULT_CRITERIA)
                : new LinkedHashSet<>(criteria);

        double[] totals = new double[routes.size()];
        List<ComparisonResult.CriterionComparison> details = new ArrayList<>(effective.size());
        Map<ComparisonCriterion, String> winners = new LinkedHashMap<>();
        for (ComparisonCriterion criterion : effective) {
            double[] scores = normalize(routes, criterion);
            ComparisonResult.CriterionComparison.CriterionComparisonBuilder detail =
                    ComparisonResult.CriterionComparison.builder().criterion(criterion);
            int winner = 0;
            for (int i = 0; i < routes.size(); i++) {
                detail.score(routes.get(i).routeId(), scores[i]);
                totals[i] += scores[i];
                if (scores[i] > scores[winner]) {
                    winner = i;
                }
            }
            String winnerId = routes.get(winner).routeId();
            winners.put(criterion, winnerId);
            details.add(detail.winner(winnerId).build());
        }

        int best = 0;
        for (int i = 1; i < routes.size(); i++) {
            if (totals[i] > totals[best]) {
                best = i;
            }
        }
        String bestId = routes.get(best).routeId();
        ComparisonResult.ComparisonResultBuilder result = ComparisonResult.builder()
                .bestRouteId(bestId)
                .bestScore(totals[best] / effective.size())
                .detailedComparison(details);
        for (Map.Entry<ComparisonCriterion, String> entry : winners.entrySet()) {
            if (entry.getValue().equals(bestId)) {
                result.reason("Best " + entry.getKey().id().replace('_', ' '));
            }
        }
        return result.build();
    }

    private static double[] normalize(List<? extends ComparableRoute> routes, ComparisonCriterion criterion) {
        double[] values = new double[routes.size()];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            values[i] = criterion.valueOf(routes.get(i));
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        double[] scores = new double[values.length];
        double span = max - min;
        for (int i = 0; i < values.length; i++) {
            if (!(span > 0.0d)) {
                scores[i] = 1.0d;
            } else if (criterion.higherIsBetter()) {
                scores[i] = (values[i] - min) / span;
            } else {
                scores[i] = (max - values[i]) / span;
            }
        }
        return scores;
    }
}
