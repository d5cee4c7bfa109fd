package org.optiroute.routing.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Risk profile across all simulated scenarios.
 */
@Value
@Builder
public class RiskAnalysis {
    @Singular
    List<String> highRiskScenarios;
    @Singular
    List<String> mitigationStrategies;
    @Singular
    List<String> contingencyPlans;
    double worstCaseCost;
    double worstCaseDurationMinutes;
    double breachRatio;
    RiskLevel riskLevel;
}
