package org.optiroute.routing.validation;

import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.cost.CostModel;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.RouteEvaluator;
import org.optiroute.routing.solver.TravelTimeModel;
import org.optiroute.routing.sustainability.SustainabilityModel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Re-times and re-costs a route under what-if scenarios.
 *
 * <p>The input route is never modified; each scenario yields a new route value.</p>
 */
public final class ScenarioSimulator {
    private static final double HIGH_CONGESTION = 0.7d;

    private final CostModel costModel;
    private final SustainabilityModel sustainabilityModel;
    private final RouteValidator validator;
    private final double highwayAvoidanceSpeedFactor;

    public ScenarioSimulator(
            CostModel costModel,
            SustainabilityModel sustainabilityModel,
            RouteValidator validator,
            double highwayAvoidanceSpeedFactor
    ) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.sustainabilityModel = Objects.requireNonNull(sustainabilityModel, "sustainabilityModel");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.highwayAvoidanceSpeedFactor = highwayAvoidanceSpeedFactor;
    }

    /**
     * Simulates a route.
     *
     * @throws IllegalArgumentException when the scenario list is empty or a scenario has a blank name
     *         or a probability outside {@code [0, 1]}.
     */
    public SimulationResult simulate(
            CandidateRoute route,
            List<Scenario> scenarios,
            RealTimeContext baseContext,
            VehicleProfile vehicle,
            Constraints constraints
    ) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(baseContext, "baseContext");
        Objects.requireNonNull(vehicle, "vehicle");
        if (scenarios == null || scenarios.isEmpty()) {
            throw new IllegalArgumentException("at least one scenario is required");
        }
        Constraints limits = constraints == null ? Constraints.unbounded() : constraints;

        SimulationResult.SimulationResultBuilder simulation = SimulationResult.builder();
        List<ScenarioResult> results = new ArrayList<>(scenarios.size());
        for (Scenario scenario : scenarios) {
            Objects.requireNonNull(scenario, "scenario");
            if (scenario.getName() == null || scenario.getName().isBlank()) {
                throw new IllegalArgumentException("scenario name must be non-blank");
            }
            if (!(scenario.getProbability() >= 0.0d && scenario.getProbability() <= 1.0d)) {
                throw new IllegalArgumentException("scenario " + scenario.getName() + " probability must be in [0, 1]");
            }
            RealTimeContext context = scenario.applyTo(baseContext);
            TravelTimeModel travel = TravelTimeModel.from(context, limits.isAvoidHighways(), highwayAvoidanceSpeedFactor);
            CandidateRoute retimed = RouteEvaluator.retime(route, travel);
            ValidationResult validation = validator.validate(retimed, limits, vehicle);
            ScenarioResult result = ScenarioResult.builder()
                    .scenarioName(scenario.getName())
                    .probability(scenario.getProbability())
                    .route(costModel.attributeStopCosts(retimed, context, vehicle, limits))
                    .cost(costModel.computeCost(retimed, context, vehicle, limits))
                    .sustainability(sustainabilityModel.computeSustainability(retimed, context, vehicle))
                    .validation(validation)
                    .risk(1.0d - validation.getFeasibilityScore())
                    .build();
            results.add(result);
            simulation.result(result);
        }
        return simulation
                .bestScenario(bestScenario(results))
                .riskAnalysis(riskAnalysis(scenarios, results))
                .build();
    }

    private static SimulationResult.BestScenario bestScenario(List<ScenarioResult> results) {
        ScenarioResult best = null;
        for (ScenarioResult result : results) {
            if (result.breachesConstraints()) {
                continue;
            }
            if (best == null || result.totalCost() < best.totalCost()) {
                best = result;
            }
        }
        List<String> reasons = new ArrayList<>();
        if (best != null) {
            reasons.add("No constraint breaches");
        } else {
            for (ScenarioResult result : results) {
                if (best == null || result.totalCost() < best.totalCost()) {
                    best = result;
                }
            }
            reasons.add("Every scenario breaches constraints");
        }
        reasons.add(String.format("Lowest cost %.2f", best.totalCost()));
        return new SimulationResult.BestScenario(best.getScenarioName(), 1.0d - best.getRisk(), reasons);
    }

    private static RiskAnalysis riskAnalysis(List<Scenario> scenarios, List<ScenarioResult> results) {
        RiskAnalysis.RiskAnalysisBuilder analysis = RiskAnalysis.builder();
        Set<String> mitigations = new LinkedHashSet<>();
        int breaches = 0;
        boolean lateness = false;
        double worstCost = 0.0d;
        double worstDuration = 0.0d;
        for (int i = 0; i < results.size(); i++) {
            ScenarioResult result = results.get(i);
            Scenario scenario = scenarios.get(i);
            worstCost = Math.max(worstCost, result.totalCost());
            worstDuration = Math.max(worstDuration, result.durationMinutes());
            if (!result.breachesConstraints()) {
                continue;
            }
            breaches++;
            analysis.highRiskScenario(result.getScenarioName());
            for (ConstraintViolation violation : result.getValidation().getViolations()) {
                switch (violation.constraint()) {
                    case RouteValidator.CONSTRAINT_TIME_WINDOW -> {
                        lateness = true;
                        mitigations.add("Negotiate wider delivery windows for late stops");
                    }
                    case RouteValidator.CONSTRAINT_MAX_DURATION ->
                            mitigations.add("Split the route across vehicles or relax the duration limit");
                    case RouteValidator.CONSTRAINT_MAX_DISTANCE ->
                            mitigations.add("Reassign distant stops to another vehicle");
                    default -> {
                    }
                }
            }
            if (scenario.getRoadCondition() != null && scenario.getRoadCondition().hazardous()) {
                mitigations.add("Dispatch winter-ready vehicles and add buffer time");
            }
            if (scenario.getCongestionLevel() != null && scenario.getCongestionLevel() > HIGH_CONGESTION) {
                mitigations.add("Depart outside peak traffic hours");
            }
            if (scenario.getFuelPriceFactor() != null && scenario.getFuelPriceFactor() > 1.0d) {
                mitigations.add("Lock in fuel prices or shift to electric vehicles");
            }
        }
        double breachRatio = (double) breaches / results.size();
        RiskLevel level = RiskLevel.fromBreachRatio(breachRatio);
        if (level == RiskLevel.HIGH) {
            analysis.contingencyPlan("Keep a standby vehicle and driver available");
        }
        if (lateness) {
            analysis.contingencyPlan("Pre-agree alternative delivery slots with affected customers");
        }
        return analysis
                .mitigationStrategies(mitigations)
                .worstCaseCost(worstCost)
                .worstCaseDurationMinutes(worstDuration)
                .breachRatio(breachRatio)
                .riskLevel(level)
                .build();
    }
}
