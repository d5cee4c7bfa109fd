package org.optiroute.routing.scoring;

import org.optiroute.routing.multimodal.MultimodalRoute;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic weighted ranking of any route set.
 *
 * <pre>
 * subScore = 1 - min(value / ceiling, 1)
 * score    = costW * cost + speedW * speed + sustainabilityW * sustainability
 * </pre>
 *
 * <p>Sorted by score descending, then lowest cost, then input order.</p>
 */
public final class RouteRanker {
    private final ScoringCeilings ceilings;

    public RouteRanker(ScoringCeilings ceilings) {
        this.ceilings = Objects.requireNonNull(ceilings, "ceilings").validate();
    }

    /**
     * One ranked route.
     *
     * @param route ranked route.
     * @param score weighted score.
     * @param costScore cost sub-score in {@code [0, 1]}.
     * @param speedScore duration sub-score in {@code [0, 1]}.
     * @param sustainabilityScore CO2 sub-score in {@code [0, 1]}.
     * @param inputIndex position in the input list.
     */
    public record RankedRoute<T extends Rankable>(
            T route,
            double score,
            double costScore,
            double speedScore,
            double sustainabilityScore,
            int inputIndex
    ) {
    }

    /**
     * Ranks routes, best first.
     *
     * @throws ScoringException on invalid weights.
     */
    public <T extends Rankable> List<RankedRoute<T>> rank(List<T> routes, ScoringWeights weights) {
        Objects.requireNonNull(routes, "routes");
        Objects.requireNonNull(weights, "weights").validate();
        List<RankedRoute<T>> ranked = new ArrayList<>(routes.size());
        for (int i = 0; i < routes.size(); i++) {
            T route = Objects.requireNonNull(routes.get(i), "route");
            double costScore = subScore(route.rankingCost(), ceilings.getCostCeiling());
            double speedScore = subScore(route.rankingDurationHours(), ceilings.getDurationCeilingHours());
            double sustainabilityScore = subScore(route.rankingCo2Kg(), ceilings.getCo2CeilingKg());
            double score = weights.getCostPriority() * costScore
                    + weights.getSpeedPriority() * speedScore
                    + weights.getSustainabilityPriority() * sustainabilityScore;
            ranked.add(new RankedRoute<>(route, score, costScore, speedScore, sustainabilityScore, i));
        }
        ranked.sort(Comparator
                .comparingDouble((RankedRoute<T> r) -> r.score()).reversed()
                .thenComparingDouble(r -> r.route().rankingCost())
                .thenComparingInt(RankedRoute::inputIndex));
        return List.copyOf(ranked);
    }

    /**
     * Ranks multimodal routes and stamps each with its score.
     */
    public List<MultimodalRoute> rankMultimodal(List<MultimodalRoute> routes, ScoringWeights weights) {
        List<RankedRoute<MultimodalRoute>> ranked = rank(routes, weights);
        List<MultimodalRoute> scored = new ArrayList<>(ranked.size());
        for (RankedRoute<MultimodalRoute> entry : ranked) {
            scored.add(entry.route().withRankScore(entry.score()));
        }
        return List.copyOf(scored);
    }

    static double subScore(double value, double ceiling) {
        if (!(value > 0.0d)) {
            return 1.0d;
        }
        return 1.0d - Math.min(value / ceiling, 1.0d);
    }
}
