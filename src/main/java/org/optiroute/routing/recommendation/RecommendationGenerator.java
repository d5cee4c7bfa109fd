package org.optiroute.routing.recommendation;

import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.TrafficIncident;
import org.optiroute.routing.solver.CandidateRoute;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evaluates the recommendation rule table.
 *
 * <p>Rules are independent and may co-fire; messages come out in table order, built-ins first.</p>
 */
public final class RecommendationGenerator {
    public static final String RULE_HIGH_CONGESTION = "HIGH_CONGESTION";
    public static final String RULE_HAZARDOUS_ROAD = "HAZARDOUS_ROAD";
    public static final String RULE_HIGH_FUEL_PRICE = "HIGH_FUEL_PRICE";
    public static final String RULE_RUSH_HOUR = "RUSH_HOUR";
    public static final String RULE_SEVERE_INCIDENT = "SEVERE_INCIDENT";
    public static final String RULE_STALE_CONTEXT = "STALE_CONTEXT";
    public static final String RULE_BELOW_FEASIBILITY = "BELOW_FEASIBILITY_THRESHOLD";
    public static final String RULE_UNASSIGNED = "UNASSIGNED_DESTINATIONS";

    private final List<RecommendationRule> rules;

    public RecommendationGenerator(RecommendationConfig config) {
        this(config, List.of());
    }

    /**
     * Creates a generator with built-in rules followed by custom rules.
     */
    public RecommendationGenerator(RecommendationConfig config, Collection<RecommendationRule> customRules) {
        Objects.requireNonNull(config, "config").validate();
        List<RecommendationRule> table = new ArrayList<>(builtInRules(config));
        if (customRules != null) {
            for (RecommendationRule rule : customRules) {
                table.add(Objects.requireNonNull(rule, "rule"));
            }
        }
        this.rules = List.copyOf(table);
    }

    /**
     * Returns every firing rule's message.
     */
    public List<String> generate(RecommendationInput input) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(input.getContext(), "input.context");
        List<String> recommendations = new ArrayList<>();
        for (RecommendationRule rule : rules) {
            if (rule.condition().test(input)) {
                recommendations.add(rule.message().apply(input));
            }
        }
        return List.copyOf(recommendations);
    }

    /**
     * Returns the rule table in evaluation order.
     */
    public List<RecommendationRule> rules() {
        return rules;
    }

    private static List<RecommendationRule> builtInRules(RecommendationConfig config) {
        return List.of(
                RecommendationRule.of(
                        RULE_HIGH_CONGESTION,
                        input -> input.getContext().getTraffic().getCongestionLevel() > config.getCongestionThreshold(),
                        "High traffic congestion: consider alternative routes or departure times"
                ),
                RecommendationRule.of(
                        RULE_HAZARDOUS_ROAD,
                        input -> {
                            RealTimeContext context = input.getContext();
                            return context.getWeather().getRoadCondition() != null
                                    && context.getWeather().getRoadCondition().hazardous();
                        },
                        "Hazardous road conditions: apply winter and safety measures"
                ),
                new RecommendationRule(
                        RULE_HIGH_FUEL_PRICE,
                        input -> input.getFuelType() != null
                                && input.getContext().getFuelPrices().getPrices().containsKey(input.getFuelType())
                                && input.getContext().getFuelPrices().price(input.getFuelType()) > config.getFuelPriceCeiling(),
                        input -> "High " + input.getFuelType().name().toLowerCase(Locale.ROOT)
                                + " prices: evaluate electric vehicles for this route"
                ),
                RecommendationRule.of(
                        RULE_RUSH_HOUR,
                        input -> input.getContext().getTimeFactors().isRushHour(),
                        "Rush hour departure: shift delivery times outside peak hours"
                ),
                RecommendationRule.of(
                        RULE_SEVERE_INCIDENT,
                        RecommendationGenerator::hasSevereIncident,
                        "High-severity traffic incident reported: monitor the affected stretch"
                ),
                new RecommendationRule(
                        RULE_STALE_CONTEXT,
                        input -> input.getContext().isStale(),
                        input -> "Real-time data unavailable for " + input.getContext().getDegradedSources()
                                + ": results use fallback values"
                ),
                RecommendationRule.of(
                        RULE_BELOW_FEASIBILITY,
                        input -> input.getSelected() != null
                                && input.getSelected().getFeasibility() < input.getFeasibilityThreshold(),
                        "No candidate met the feasibility threshold: review time windows and limits"
                ),
                new RecommendationRule(
                        RULE_UNASSIGNED,
                        input -> unassignedCount(input.getSelected()) > 0,
                        input -> unassignedCount(input.getSelected())
                                + " destination(s) could not be assigned: consider an additional vehicle"
                )
        );
    }

    private static boolean hasSevereIncident(RecommendationInput input) {
        for (TrafficIncident incident : input.getContext().getTraffic().getIncidents()) {
            if (incident.getSeverity() == TrafficIncident.Severity.HIGH) {
                return true;
            }
        }
        return false;
    }

    private static int unassignedCount(CandidateRoute selected) {
        return selected == null ? 0 : selected.getUnassignedDestinationIds().size();
    }
}
