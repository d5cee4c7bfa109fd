package org.optiroute.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.context.RealTimeContext;
import org.optiroute.routing.context.RealTimeContextProvider;
import org.optiroute.routing.context.RealTimeDataProvider;
import org.optiroute.routing.context.TimeFactorResolver;
import org.optiroute.routing.cost.CostBreakdown;
import org.optiroute.routing.cost.CostModel;
import org.optiroute.routing.event.EventSink;
import org.optiroute.routing.event.NoopEventSink;
import org.optiroute.routing.event.OptimizationCompletedEvent;
import org.optiroute.routing.model.Constraints;
import org.optiroute.routing.model.Destination;
import org.optiroute.routing.model.FuelType;
import org.optiroute.routing.model.OptimizationRequest;
import org.optiroute.routing.model.RealTimeFactorFlags;
import org.optiroute.routing.model.VehicleProfile;
import org.optiroute.routing.multimodal.CargoProfile;
import org.optiroute.routing.multimodal.HubDirectory;
import org.optiroute.routing.multimodal.LegTemplateCatalog;
import org.optiroute.routing.multimodal.MultimodalLegPlanner;
import org.optiroute.routing.multimodal.MultimodalRoute;
import org.optiroute.routing.multimodal.StaticHubDirectory;
import org.optiroute.routing.recommendation.RecommendationGenerator;
import org.optiroute.routing.recommendation.RecommendationInput;
import org.optiroute.routing.recommendation.RecommendationRule;
import org.optiroute.routing.scoring.ComparisonCriterion;
import org.optiroute.routing.scoring.ComparisonResult;
import org.optiroute.routing.scoring.RouteComparator;
import org.optiroute.routing.scoring.RouteRanker;
import org.optiroute.routing.scoring.ScoringWeights;
import org.optiroute.routing.solver.CandidateRoute;
import org.optiroute.routing.solver.RouteSolver;
import org.optiroute.routing.solver.RoutingProblem;
import org.optiroute.routing.solver.SolverAlgorithm;
import org.optiroute.routing.solver.SolverException;
import org.optiroute.routing.solver.SolverRegistry;
import org.optiroute.routing.store.InMemorySavedRouteStore;
import org.optiroute.routing.store.SavedRoute;
import org.optiroute.routing.store.SavedRoutePayload;
import org.optiroute.routing.store.SavedRoutePayloadCodec;
import org.optiroute.routing.store.SavedRouteStore;
import org.optiroute.routing.store.SavedRouteStoreException;
import org.optiroute.routing.sustainability.SustainabilityMetrics;
import org.optiroute.routing.sustainability.SustainabilityModel;
import org.optiroute.routing.validation.RouteValidator;
import org.optiroute.routing.validation.Scenario;
import org.optiroute.routing.validation.ScenarioSimulator;
import org.optiroute.routing.validation.SimulationResult;
import org.optiroute.routing.validation.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main optimization entry point.
 *
 * <p>One {@link #optimizeRoutes} call walks the run through:</p>
 * <ul>
 * <li>Validate the request before any work starts.</li>
 * <li>Collect the real-time context (concurrent sub-fetches with fallbacks).</li>
 * <li>Run every enabled solver concurrently under the per-solver timeout.</li>
 * <li>Select the most efficient candidate clearing the feasibility threshold.</li>
 * <li>Attach cost and sustainability metrics, then recommendations.</li>
 * <li>Persist when requested and publish the completion event.</li>
 * </ul>
 *
 * <p>Solvers share only immutable inputs. The saved-route store is the only shared mutable
 * collaborator.</p>
 *
 * <p>{@link #close()} shuts down the thread pools the orchestrator created for itself. Executors
 * passed to the builder stay under the caller's control.</p>
 */
@Slf4j
public final class OptimizationOrchestrator implements RouteOptimizationService, AutoCloseable {
    /** Vehicle used when simulating a route without an explicit vehicle. */
    public static final VehicleProfile REFERENCE_VEHICLE = VehicleProfile.builder()
            .id("reference")
            .capacityKg(Double.MAX_VALUE)
            .volumeCapacityM3(Double.MAX_VALUE)
            .fuelType(FuelType.DIESEL)
            .build();

    private static final List<ConstraintDescriptor> CONSTRAINTS = List.of(
            new ConstraintDescriptor("max_route_duration", "Upper bound on route duration", "minutes"),
            new ConstraintDescriptor("max_distance", "Upper bound on route distance", "km"),
            new ConstraintDescriptor("avoid_tolls", "Skip toll roads; toll cost becomes zero", null),
            new ConstraintDescriptor("avoid_highways", "Skip highways at reduced travel speed", null),
            new ConstraintDescriptor("prefer_electric_charging", "Prefer routes past charging points", null),
            new ConstraintDescriptor("time_windows", "Per-destination delivery windows", "instant"),
            new ConstraintDescriptor("vehicle_capacity", "Vehicle weight capacity", "kg"),
            new ConstraintDescriptor("vehicle_volume_capacity", "Vehicle volume capacity", "m3")
    );

    private final OptimizerConfig config;
    private final SolverRegistry solverRegistry;
    private final RealTimeContextProvider contextProvider;
    private final TimeFactorResolver timeFactorResolver;
    private final CostModel costModel;
    private final SustainabilityModel sustainabilityModel;
    private final RecommendationGenerator recommendationGenerator;
    private final RouteValidator routeValidator;
    private final ScenarioSimulator scenarioSimulator;
    private final MultimodalLegPlanner legPlanner;
    private final RouteRanker routeRanker;
    private final RouteComparator routeComparator;
    private final SavedRouteStore savedRouteStore;
    private final SavedRoutePayloadCodec payloadCodec;
    private final EventSink eventSink;
    private final ExecutorService solverExecutor;
    private final List<ExecutorService> ownedExecutors = new ArrayList<>(2);
    private final Clock clock;

    /**
     * Creates the orchestrator.
     *
     * @param config engine configuration; defaults when {@code null}.
     * @param dataProvider real-time data collaborator.
     * @param solverRegistry solver set; built-ins when {@code null}.
     * @param hubDirectory hub lookup for multimodal planning; empty directory when {@code null}.
     * @param templateCatalog multimodal template catalog; built-ins when {@code null}.
     * @param savedRouteStore persistence collaborator; in-memory store when {@code null}.
     * @param eventSink event collaborator; no-op when {@code null}.
     * @param recommendationRules extra recommendation rules appended after the built-ins.
     * @param solverExecutor executor running solver tasks; daemon pool when {@code null}.
     * @param contextExecutor executor running context sub-fetches; daemon pool when {@code null}.
     * @param clock clock for default departure times and timestamps; UTC when {@code null}.
     */
    @Builder
    public OptimizationOrchestrator(
            OptimizerConfig config,
            RealTimeDataProvider dataProvider,
            SolverRegistry solverRegistry,
            HubDirectory hubDirectory,
            LegTemplateCatalog templateCatalog,
            SavedRouteStore savedRouteStore,
            EventSink eventSink,
            Collection<RecommendationRule> recommendationRules,
            ExecutorService solverExecutor,
            Executor contextExecutor,
            Clock clock
    ) {
        this.config = (config == null ? OptimizerConfig.defaults() : config).validate();
        this.solverRegistry = solverRegistry == null ? SolverRegistry.defaultRegistry() : solverRegistry;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.timeFactorResolver = new TimeFactorResolver(this.config.getZoneId(), this.config.getHolidays());
        Objects.requireNonNull(dataProvider, "dataProvider");
        this.contextProvider = new RealTimeContextProvider(
                dataProvider,
                contextExecutor == null ? ownedPool("optiroute-context") : contextExecutor,
                this.config.getContextTimeout(),
                timeFactorResolver
        );
        this.costModel = new CostModel(this.config.getCostModel());
        this.sustainabilityModel = new SustainabilityModel(
                this.config.getSustainability(),
                costModel.fuelConsumptionModel()
        );
        this.recommendationGenerator = new RecommendationGenerator(
                this.config.getRecommendation(),
                recommendationRules == null ? List.of() : recommendationRules
        );
        this.routeValidator = new RouteValidator();
        this.scenarioSimulator = new ScenarioSimulator(
                costModel,
                sustainabilityModel,
                routeValidator,
                this.config.getSolverSettings().getHighwayAvoidanceSpeedFactor()
        );
        if (hubDirectory == null) {
            log.info("No hub directory configured; multimodal planning offers the direct road haul only");
        }
        this.legPlanner = new MultimodalLegPlanner(
                hubDirectory == null ? new StaticHubDirectory(List.of()) : hubDirectory,
                templateCatalog == null ? LegTemplateCatalog.defaultCatalog() : templateCatalog,
                this.config.getMultimodal()
        );
        this.routeRanker = new RouteRanker(this.config.getScoringCeilings());
        this.routeComparator = new RouteComparator();
        this.savedRouteStore = savedRouteStore == null ? new InMemorySavedRouteStore(this.clock) : savedRouteStore;
        this.payloadCodec = new SavedRoutePayloadCodec();
        this.eventSink = eventSink == null ? NoopEventSink.INSTANCE : eventSink;
        this.solverExecutor = solverExecutor == null ? ownedPool("optiroute-solver") : solverExecutor;
    }

    /**
     * Shuts down the pools this orchestrator created. Injected executors are left running.
     */
    @Override
    public void close() {
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdownNow();
        }
        log.debug("Shut down {} owned executor(s)", ownedExecutors.size());
    }

    List<ExecutorService> ownedExecutors() {
        return List.copyOf(ownedExecutors);
    }

    private ExecutorService ownedPool(String prefix) {
        ExecutorService pool = Executors.newCachedThreadPool(daemonThreads(prefix));
        ownedExecutors.add(pool);
        return pool;
    }

    @Override
    public OptimizationResult optimizeRoutes(OptimizationRequest request) {
        long startNanos = System.nanoTime();
        validateRequest(request);
        String requestId = request.getRequestId() == null || request.getRequestId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getRequestId();
        Duration deadline = request.getDeadline() == null ? config.getDefaultDeadline() : request.getDeadline();
        long deadlineNanos = startNanos + deadline.toNanos();
        Instant departure = request.getDepartureTime() == null ? clock.instant() : request.getDepartureTime();
        OptimizationRequest resolved = request.toBuilder()
                .requestId(requestId)
                .departureTime(departure)
                .constraints(request.getConstraints() == null ? Constraints.unbounded() : request.getConstraints())
                .build();

        OptimizationTelemetry.OptimizationTelemetryBuilder telemetry = OptimizationTelemetry.builder();
        List<OptimizationState> history = new ArrayList<>();
        log.info("Optimization {} started with {} destinations", requestId, resolved.getDestinations().size());
        try {
            return run(resolved, deadlineNanos, startNanos, telemetry, history);
        } catch (RuntimeException ex) {
            history.add(OptimizationState.FAILED);
            log.warn("Optimization {} failed after states {}: {}", requestId, history, ex.getMessage());
            throw ex;
        }
    }

    private OptimizationResult run(
            OptimizationRequest request,
            long deadlineNanos,
            long startNanos,
            OptimizationTelemetry.OptimizationTelemetryBuilder telemetry,
            List<OptimizationState> history
    ) {
        String requestId = request.getRequestId();
        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder().requestId(requestId);

        enter(history, OptimizationState.COLLECTING_CONTEXT);
        RealTimeContext context = contextProvider.collect(
                request.getOrigin().getLocation(),
                destinationPoints(request.getDestinations()),
                request.getRegion() == null ? config.getDefaultRegion() : request.getRegion(),
                request.getDepartureTime(),
                request.getRealTimeFactors()
        );
        ensureWithinDeadline(deadlineNanos, "context collection");
        result.context(context);
        telemetry.contextStale(context.isStale()).degradedSources(context.getDegradedSources());
        if (context.isStale()) {
            result.warning(new OptimizationWarning(
                    OptimizationWarning.STALE_CONTEXT,
                    "Real-time sources " + context.getDegradedSources()
                            + " unavailable; using last-known or default values"
            ));
        }

        RoutingProblem problem = RoutingProblem.of(request, context, config.getSolverSettings());
        if (!problem.unassignedDestinationIds().isEmpty()) {
            result.warning(new OptimizationWarning(
                    OptimizationWarning.UNASSIGNED_DESTINATIONS,
                    problem.unassignedDestinationIds().size() + " destination(s) exceed vehicle capacity"
            ));
        }

        RouteOutcome outcome = null;
        CandidateRoute selected = null;
        if (problem.size() > 0) {
            enter(history, OptimizationState.RUNNING_SOLVERS);
            List<CandidateRoute> candidates = runSolvers(problem, deadlineNanos, telemetry);

            enter(history, OptimizationState.SELECTING_BEST);
            double threshold = config.getFeasibilityThreshold();
            selected = selectBest(candidates, threshold);
            telemetry.selectedAlgorithm(selected.getAlgorithm());
            if (selected.getFeasibility() < threshold) {
                result.warning(new OptimizationWarning(
                        OptimizationWarning.BELOW_FEASIBILITY_THRESHOLD,
                        String.format("Best feasibility %.2f is below threshold %.2f", selected.getFeasibility(), threshold)
                ));
            }

            enter(history, OptimizationState.ENRICHING);
            outcome = enrich(requestId, selected, context, request.getVehicle(), request.getConstraints());
            result.route(outcome);
        }

        enter(history, OptimizationState.RECOMMENDING);
        List<String> recommendations = recommendations(context, request.getVehicle(), selected, problem, outcome);
        ensureWithinDeadline(deadlineNanos, "enrichment");

        String savedRouteId = null;
        if (outcome != null && request.getSaveAsName() != null && !request.getSaveAsName().isBlank()) {
            savedRouteId = persist(
                    outcome,
                    request.getSaveAsName(),
                    "Optimized by " + selected.getAlgorithm().displayName() + " for request " + requestId,
                    request.getOwnerId()
            ).getId();
        }

        Summary summary = summarize(request, problem, outcome, recommendations);
        publishCompletion(requestId, summary, result);
        enter(history, OptimizationState.COMPLETED);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info(
                "Optimization {} completed in {} ms with {} route(s)",
                requestId,
                elapsed.toMillis(),
                summary.getTotalRoutes()
        );
        return result
                .summary(summary)
                .savedRouteId(savedRouteId)
                .telemetry(telemetry.stateHistory(history).elapsed(elapsed).build())
                .build();
    }

    private List<CandidateRoute> runSolvers(
            RoutingProblem problem,
            long deadlineNanos,
            OptimizationTelemetry.OptimizationTelemetryBuilder telemetry
    ) {
        List<SolverAlgorithm> algorithms = enabledAlgorithms();
        List<Callable<SolverRun>> tasks = new ArrayList<>(algorithms.size());
        for (SolverAlgorithm algorithm : algorithms) {
            RouteSolver solver = solverRegistry.solver(algorithm);
            tasks.add(() -> runSolver(solver, problem));
        }

        long solverTimeoutNanos = config.getSolverSettings().getSolverTimeout().toNanos();
        long remainingNanos = deadlineNanos - System.nanoTime();
        boolean deadlineBound = remainingNanos < solverTimeoutNanos;
        List<Future<SolverRun>> futures;
        try {
            futures = solverExecutor.invokeAll(
                    tasks,
                    Math.max(0L, Math.min(solverTimeoutNanos, remainingNanos)),
                    TimeUnit.NANOSECONDS
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OptimizationException(
                    OptimizationException.REASON_DEADLINE_EXCEEDED,
                    "interrupted while waiting for solvers",
                    ex
            );
        }

        List<CandidateRoute> candidates = new ArrayList<>();
        List<SolverException> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SolverAlgorithm algorithm = algorithms.get(i);
            SolverRun run = await(algorithm, futures.get(i), solverTimeoutNanos);
            telemetry.solverOutcome(new OptimizationTelemetry.SolverOutcome(
                    algorithm,
                    run.route() != null,
                    run.failure() == null ? null : run.failure().getReasonCode(),
                    run.elapsed()
            ));
            if (run.route() != null) {
                log.debug("Solver {} finished in {} ms", algorithm.id(), run.elapsed().toMillis());
                candidates.add(run.route());
            } else {
                log.warn("Solver {} excluded: {}", algorithm.id(), run.failure().getMessage());
                failures.add(run.failure());
            }
        }

        if (candidates.isEmpty()) {
            if (deadlineBound && System.nanoTime() - deadlineNanos >= 0L) {
                throw new OptimizationException(
                        OptimizationException.REASON_DEADLINE_EXCEEDED,
                        "deadline passed while solvers were running"
                );
            }
            OptimizationException failure = new OptimizationException(
                    OptimizationException.REASON_ALL_SOLVERS_FAILED,
                    "all " + algorithms.size() + " solvers failed"
            );
            for (SolverException cause : failures) {
                failure.addSuppressed(cause);
            }
            throw failure;
        }
        return candidates;
    }

    private static SolverRun runSolver(RouteSolver solver, RoutingProblem problem) {
        long start = System.nanoTime();
        try {
            CandidateRoute route = solver.solve(problem);
            if (route == null) {
                throw new IllegalStateException("solver returned no route");
            }
            return new SolverRun(route, null, Duration.ofNanos(System.nanoTime() - start));
        } catch (SolverException ex) {
            return new SolverRun(null, ex, Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException ex) {
            return new SolverRun(
                    null,
                    SolverException.failed(solver.algorithm(), ex),
                    Duration.ofNanos(System.nanoTime() - start)
            );
        }
    }

    private static SolverRun await(SolverAlgorithm algorithm, Future<SolverRun> future, long timeoutNanos) {
        try {
            return future.get();
        } catch (CancellationException ex) {
            return new SolverRun(
                    null,
                    SolverException.timeout(algorithm, "exceeded " + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms"),
                    Duration.ofNanos(timeoutNanos)
            );
        } catch (ExecutionException ex) {
            return new SolverRun(null, SolverException.failed(algorithm, ex.getCause()), Duration.ZERO);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new SolverRun(null, SolverException.timeout(algorithm, "interrupted"), Duration.ZERO);
        }
    }

    private List<SolverAlgorithm> enabledAlgorithms() {
        List<SolverAlgorithm> algorithms = new ArrayList<>();
        for (SolverAlgorithm algorithm : solverRegistry.algorithms()) {
            if (config.getEnabledAlgorithms().isEmpty() || config.getEnabledAlgorithms().contains(algorithm)) {
                algorithms.add(algorithm);
            }
        }
        if (algorithms.isEmpty()) {
            throw new OptimizationException(
                    OptimizationException.REASON_ALL_SOLVERS_FAILED,
                    "no enabled solver is registered"
            );
        }
        return algorithms;
    }

    /**
     * Most efficient candidate clearing {@code threshold}; otherwise the most feasible one.
     * Remaining ties go to the shorter route, then to algorithm declaration order.
     */
    static CandidateRoute selectBest(List<CandidateRoute> candidates, double threshold) {
        CandidateRoute best = null;
        for (CandidateRoute candidate : candidates) {
            if (candidate.getFeasibility() < threshold) {
                continue;
            }
            if (best == null || isBetter(candidate.getEfficiency(), best.getEfficiency(), candidate, best)) {
                best = candidate;
            }
        }
        if (best != null) {
            return best;
        }
        for (CandidateRoute candidate : candidates) {
            if (best == null || isBetter(candidate.getFeasibility(), best.getFeasibility(), candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static boolean isBetter(double value, double bestValue, CandidateRoute candidate, CandidateRoute best) {
        if (value != bestValue) {
            return value > bestValue;
        }
        if (candidate.getTotalDistanceKm() != best.getTotalDistanceKm()) {
            return candidate.getTotalDistanceKm() < best.getTotalDistanceKm();
        }
        return candidate.getAlgorithm().ordinal() < best.getAlgorithm().ordinal();
    }

    private RouteOutcome enrich(
            String requestId,
            CandidateRoute selected,
            RealTimeContext context,
            VehicleProfile vehicle,
            Constraints constraints
    ) {
        CostBreakdown cost = costModel.computeCost(selected, context, vehicle, constraints);
        SustainabilityMetrics sustainability = sustainabilityModel.computeSustainability(selected, context, vehicle);
        return RouteOutcome.builder()
                .routeId(requestId + "-" + selected.getAlgorithm().id())
                .candidate(costModel.attributeStopCosts(selected, context, vehicle, constraints))
                .cost(cost)
                .sustainability(sustainability)
                .build();
    }

    private List<String> recommendations(
            RealTimeContext context,
            VehicleProfile vehicle,
            CandidateRoute selected,
            RoutingProblem problem,
            RouteOutcome outcome
    ) {
        CandidateRoute subject = selected;
        if (subject == null && !problem.unassignedDestinationIds().isEmpty()) {
            CandidateRoute.CandidateRouteBuilder empty = CandidateRoute.builder()
                    .departureTime(problem.departureTime())
                    .feasibility(0.0d);
            for (String id : problem.unassignedDestinationIds()) {
                empty.unassignedDestinationId(id);
            }
            subject = empty.build();
        }
        Set<String> recommendations = new LinkedHashSet<>(recommendationGenerator.generate(RecommendationInput.builder()
                .context(context)
                .fuelType(vehicle.getFuelType())
                .selected(subject)
                .feasibilityThreshold(config.getFeasibilityThreshold())
                .build()));
        if (outcome != null) {
            recommendations.addAll(outcome.getSustainability().getRecommendations());
        }
        return List.copyOf(recommendations);
    }

    private static Summary summarize(
            OptimizationRequest request,
            RoutingProblem problem,
            RouteOutcome outcome,
            List<String> recommendations
    ) {
        Summary.SummaryBuilder summary = Summary.builder()
                .totalDestinations(request.getDestinations().size())
                .totalRoutes(outcome == null ? 0 : 1)
                .recommendations(recommendations);
        for (String id : problem.unassignedDestinationIds()) {
            summary.unassignedDestinationId(id);
        }
        if (outcome == null) {
            return summary.build();
        }
        CandidateRoute route = outcome.getCandidate();
        for (String id : route.getUnassignedDestinationIds()) {
            if (!problem.unassignedDestinationIds().contains(id)) {
                summary.unassignedDestinationId(id);
            }
        }
        return summary
                .assignedDestinations(route.getStops().size())
                .totalDistanceKm(route.getTotalDistanceKm())
                .totalDurationMinutes(route.getTotalDurationMinutes())
                .totalCost(outcome.getCost().total())
                .totalCo2Kg(outcome.getSustainability().getCo2EmissionsKg())
                .averageEfficiency(route.getEfficiency())
                .build();
    }

    private void publishCompletion(String requestId, Summary summary, OptimizationResult.OptimizationResultBuilder result) {
        OptimizationCompletedEvent event = OptimizationCompletedEvent.builder()
                .requestId(requestId)
                .totalDestinations(summary.getTotalDestinations())
                .totalRoutes(summary.getTotalRoutes())
                .totalCost(summary.getTotalCost())
                .averageEfficiency(summary.getAverageEfficiency())
                .build();
        try {
            eventSink.publish(OptimizationCompletedEvent.NAME, event);
        } catch (RuntimeException ex) {
            log.warn("Publishing {} for {} failed: {}", OptimizationCompletedEvent.NAME, requestId, ex.getMessage());
            result.warning(new OptimizationWarning(
                    OptimizationWarning.EVENT_PUBLISH_FAILED,
                    "Completion event not delivered: " + ex.getMessage()
            ));
        }
    }

    @Override
    public List<MultimodalRoute> planMultimodalRoutes(
            GeoPoint origin,
            GeoPoint destination,
            CargoProfile cargo,
            ScoringWeights weights
    ) {
        requirePoint(origin, "origin");
        requirePoint(destination, "destination");
        if (cargo == null) {
            throw new OptimizationException(OptimizationException.REASON_CARGO_REQUIRED, "cargo is required");
        }
        List<MultimodalRoute> routes = legPlanner.planRoutes(origin, destination, cargo);
        return routeRanker.rankMultimodal(routes, weights == null ? ScoringWeights.balanced() : weights);
    }

    @Override
    public ValidationResult validateRoute(CandidateRoute route, Constraints constraints) {
        return validateRoute(route, constraints, null);
    }

    @Override
    public ValidationResult validateRoute(CandidateRoute route, Constraints constraints, VehicleProfile vehicle) {
        requireRoute(route);
        return routeValidator.validate(route, constraints == null ? Constraints.unbounded() : constraints, vehicle);
    }

    @Override
    public SimulationResult simulateRoute(CandidateRoute route, List<Scenario> scenarios) {
        requireRoute(route);
        Instant at = route.getDepartureTime() == null ? clock.instant() : route.getDepartureTime();
        RealTimeContext neutral = RealTimeContext.builder()
                .traffic(ContextDefaults.traffic())
                .weather(ContextDefaults.weather())
                .fuelPrices(ContextDefaults.fuelPrices(config.getDefaultRegion()))
                .timeFactors(timeFactorResolver.resolve(at))
                .capturedAt(clock.instant())
                .build();
        return simulateRoute(route, scenarios, neutral, REFERENCE_VEHICLE, Constraints.unbounded());
    }

    @Override
    public SimulationResult simulateRoute(
            CandidateRoute route,
            List<Scenario> scenarios,
            RealTimeContext baseContext,
            VehicleProfile vehicle,
            Constraints constraints
    ) {
        requireRoute(route);
        if (scenarios == null || scenarios.isEmpty()) {
            throw new OptimizationException(OptimizationException.REASON_SCENARIOS_REQUIRED, "at least one scenario is required");
        }
        validateScenarios(scenarios);
        Objects.requireNonNull(baseContext, "baseContext");
        return scenarioSimulator.simulate(
                route,
                scenarios,
                baseContext,
                vehicle == null ? REFERENCE_VEHICLE : vehicle,
                constraints
        );
    }

    @Override
    public ComparisonResult compareRoutes(List<RouteOutcome> routes, List<ComparisonCriterion> criteria) {
        return routeComparator.compare(routes, criteria);
    }

    @Override
    public RealTimeContext currentContext(GeoPoint origin, List<GeoPoint> destinations, String region) {
        requirePoint(origin, "origin");
        return contextProvider.collect(
                origin,
                destinations,
                region == null ? config.getDefaultRegion() : region,
                clock.instant(),
                RealTimeFactorFlags.all()
        );
    }

    @Override
    public SavedRoute saveRoute(RouteOutcome outcome, String name, String description, String ownerId) {
        if (outcome == null) {
            throw new OptimizationException(OptimizationException.REASON_ROUTE_REQUIRED, "outcome is required");
        }
        if (name == null || name.isBlank()) {
            throw new OptimizationException(OptimizationException.REASON_NAME_REQUIRED, "name must be non-blank");
        }
        return persist(outcome, name, description, ownerId);
    }

    @Override
    public List<SavedRoute> savedRoutes(String search, String ownerId) {
        try {
            return savedRouteStore.find(search, ownerId);
        } catch (RuntimeException ex) {
            throw persistenceFailure("listing saved routes", ex);
        }
    }

    @Override
    public boolean deleteSavedRoute(String savedRouteId) {
        try {
            return savedRouteStore.delete(savedRouteId);
        } catch (RuntimeException ex) {
            throw persistenceFailure("deleting saved route " + savedRouteId, ex);
        }
    }

    @Override
    public SavedRoute reassignSavedRoute(String savedRouteId, String newOwnerId) {
        try {
            return savedRouteStore.reassign(savedRouteId, newOwnerId);
        } catch (SavedRouteStoreException ex) {
            if (SavedRouteStoreException.REASON_NOT_FOUND.equals(ex.getReasonCode())) {
                throw new OptimizationException(
                        OptimizationException.REASON_SAVED_ROUTE_NOT_FOUND,
                        "no saved route with id " + savedRouteId,
                        ex
                );
            }
            throw persistenceFailure("reassigning saved route " + savedRouteId, ex);
        } catch (RuntimeException ex) {
            throw persistenceFailure("reassigning saved route " + savedRouteId, ex);
        }
    }

    @Override
    public List<SolverAlgorithm> availableAlgorithms() {
        return List.copyOf(solverRegistry.algorithms());
    }

    @Override
    public List<ConstraintDescriptor> availableConstraints() {
        return CONSTRAINTS;
    }

    /**
     * Returns the configuration this orchestrator runs with.
     */
    public OptimizerConfig config() {
        return config;
    }

    private SavedRoute persist(RouteOutcome outcome, String name, String description, String ownerId) {
        try {
            String payload = payloadCodec.encode(SavedRoutePayload.from(
                    outcome.getCandidate(),
                    outcome.getCost(),
                    outcome.getSustainability()
            ));
            return savedRouteStore.save(name, description, payload, ownerId);
        } catch (RuntimeException ex) {
            throw persistenceFailure("saving route '" + name + "'", ex);
        }
    }

    private static OptimizationException persistenceFailure(String action, RuntimeException cause) {
        return new OptimizationException(
                OptimizationException.REASON_PERSISTENCE_FAILED,
                action + " failed: " + cause.getMessage(),
                cause
        );
    }

    private static void enter(List<OptimizationState> history, OptimizationState state) {
        history.add(state);
        log.debug("-> {}", state);
    }

    private static void ensureWithinDeadline(long deadlineNanos, String stage) {
        if (System.nanoTime() - deadlineNanos > 0L) {
            throw new OptimizationException(
                    OptimizationException.REASON_DEADLINE_EXCEEDED,
                    "deadline passed during " + stage
            );
        }
    }

    private static List<GeoPoint> destinationPoints(List<Destination> destinations) {
        List<GeoPoint> points = new ArrayList<>(destinations.size());
        for (Destination destination : destinations) {
            points.add(destination.getLocation());
        }
        return points;
    }

    private static void validateRequest(OptimizationRequest request) {
        if (request == null) {
            throw new OptimizationException(OptimizationException.REASON_REQUEST_REQUIRED, "request is required");
        }
        if (request.getOrigin() == null || request.getOrigin().getLocation() == null) {
            throw new OptimizationException(OptimizationException.REASON_ORIGIN_REQUIRED, "origin location is required");
        }
        if (!request.getOrigin().getLocation().isValid()) {
            throw new OptimizationException(
                    OptimizationException.REASON_INVALID_COORDINATES,
                    "origin coordinates out of range: " + request.getOrigin().getLocation()
            );
        }
        if (request.getOrigin().getTimeWindow() != null && !request.getOrigin().getTimeWindow().isWellFormed()) {
            throw new OptimizationException(OptimizationException.REASON_INVALID_TIME_WINDOW, "origin time window ends before it starts");
        }
        validateVehicle(request.getVehicle());
        validateDestinations(request.getDestinations());
        Constraints constraints = request.getConstraints();
        if (constraints != null
                && (!(constraints.getMaxRouteDurationMinutes() > 0.0d) || !(constraints.getMaxDistanceKm() > 0.0d))) {
            throw new OptimizationException(
                    OptimizationException.REASON_INVALID_CONSTRAINTS,
                    "max route duration and max distance must be > 0"
            );
        }
        Duration deadline = request.getDeadline();
        if (deadline != null && (deadline.isZero() || deadline.isNegative())) {
            throw new OptimizationException(OptimizationException.REASON_INVALID_DEADLINE, "deadline must be > 0");
        }
    }

    private static void validateVehicle(VehicleProfile vehicle) {
        if (vehicle == null) {
            throw new OptimizationException(OptimizationException.REASON_VEHICLE_REQUIRED, "vehicle is required");
        }
        if (vehicle.getFuelType() == null) {
            throw new OptimizationException(OptimizationException.REASON_VEHICLE_REQUIRED, "vehicle fuel type is required");
        }
        if (!(vehicle.getCapacityKg() >= 0.0d) || !(vehicle.getVolumeCapacityM3() >= 0.0d)) {
            throw new OptimizationException(
                    OptimizationException.REASON_INVALID_CAPACITY,
                    "vehicle capacity and volume capacity must be >= 0"
            );
        }
    }

    private static void validateDestinations(List<Destination> destinations) {
        Set<String> ids = new HashSet<>();
        for (Destination destination : destinations) {
            if (destination == null) {
                throw new OptimizationException(OptimizationException.REASON_INVALID_DESTINATION, "destination must be non-null");
            }
            String id = destination.getId();
            if (id == null || id.isBlank()) {
                throw new OptimizationException(OptimizationException.REASON_INVALID_DESTINATION, "destination id must be non-blank");
            }
            if (!ids.add(id)) {
                throw new OptimizationException(OptimizationException.REASON_INVALID_DESTINATION, "duplicate destination id: " + id);
            }
            if (destination.getLocation() == null || !destination.getLocation().isValid()) {
                throw new OptimizationException(
                        OptimizationException.REASON_INVALID_COORDINATES,
                        "destination " + id + " has invalid coordinates"
                );
            }
            if (!(destination.getWeightKg() >= 0.0d)
                    || !(destination.getVolumeM3() >= 0.0d)
                    || !(destination.getServiceTimeMinutes() >= 0.0d)) {
                throw new OptimizationException(
                        OptimizationException.REASON_INVALID_DESTINATION,
                        "destination " + id + " has negative weight, volume or service time"
                );
            }
            if (destination.getTimeWindow() != null && !destination.getTimeWindow().isWellFormed()) {
                throw new OptimizationException(
                        OptimizationException.REASON_INVALID_TIME_WINDOW,
                        "destination " + id + " time window ends before it starts"
                );
            }
        }
    }

    private static void validateScenarios(List<Scenario> scenarios) {
        for (Scenario scenario : scenarios) {
            if (scenario == null || scenario.getName() == null || scenario.getName().isBlank()) {
                throw new OptimizationException(OptimizationException.REASON_INVALID_SCENARIO, "scenario name must be non-blank");
            }
            double probability = scenario.getProbability();
            if (!(probability >= 0.0d && probability <= 1.0d)) {
                throw new OptimizationException(
                        OptimizationException.REASON_INVALID_SCENARIO,
                        "scenario " + scenario.getName() + " probability must be in [0, 1], got " + probability
                );
            }
        }
    }

    private static void requirePoint(GeoPoint point, String field) {
        if (point == null) {
            throw new OptimizationException(OptimizationException.REASON_ORIGIN_REQUIRED, field + " is required");
        }
        if (!point.isValid()) {
            throw new OptimizationException(OptimizationException.REASON_INVALID_COORDINATES, field + " coordinates out of range");
        }
    }

    private static void requireRoute(CandidateRoute route) {
        if (route == null) {
            throw new OptimizationException(OptimizationException.REASON_ROUTE_REQUIRED, "route is required");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record SolverRun(CandidateRoute route, SolverException failure, Duration elapsed) {
    }
}
