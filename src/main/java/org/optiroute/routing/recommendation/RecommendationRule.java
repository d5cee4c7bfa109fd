package org.optiroute.routing.recommendation;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One independent recommendation rule.
 *
 * @param id stable rule id.
 * @param condition fires the rule.
 * @param message recommendation text for a firing rule.
 */
public record RecommendationRule(
        String id,
        Predicate<RecommendationInput> condition,
        Function<RecommendationInput, String> message
) {
    public RecommendationRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Rule with a fixed message.
     */
    public static RecommendationRule of(String id, Predicate<RecommendationInput> condition, String message) {
        return new RecommendationRule(id, condition, input -> message);
    }
}
