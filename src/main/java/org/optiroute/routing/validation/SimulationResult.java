package org.optiroute.routing.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of simulating one route across scenarios.
 */
@Value
@Builder
public class SimulationResult {
    @Singular
    List<ScenarioResult> results;
    BestScenario bestScenario;
    RiskAnalysis riskAnalysis;

    /**
     * Cheapest non-breaching scenario, or cheapest overall when every scenario breaches.
     *
     * @param scenario scenario name.
     * @param score {@code 1 - risk} of that scenario.
     * @param reasons why it was chosen.
     */
    public record BestScenario(String scenario, double score, List<String> reasons) {
        public BestScenario {
            reasons = List.copyOf(reasons);
        }
    }
}
