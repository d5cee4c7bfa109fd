package org.optiroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.cost.CostModelConfig;
import org.optiroute.routing.multimodal.MultimodalConfig;
import org.optiroute.routing.recommendation.RecommendationConfig;
import org.optiroute.routing.scoring.ScoringCeilings;
import org.optiroute.routing.solver.SolverAlgorithm;
import org.optiroute.routing.solver.SolverSettings;
import org.optiroute.routing.sustainability.SustainabilityConfig;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable engine configuration injected into {@link OptimizationOrchestrator}.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {
    public static final double DEFAULT_FEASIBILITY_THRESHOLD = 0.8d;
    public static final Duration DEFAULT_CONTEXT_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(30);

    public static final String PROPERTY_PREFIX = "optiroute.";
    public static final String PROPERTY_FEASIBILITY_THRESHOLD = PROPERTY_PREFIX + "feasibilityThreshold";
    public static final String PROPERTY_SOLVER_TIMEOUT_MS = PROPERTY_PREFIX + "solverTimeoutMs";
    public static final String PROPERTY_SEARCH_TIME_LIMIT_MS = PROPERTY_PREFIX + "searchTimeLimitMs";
    public static final String PROPERTY_CONTEXT_TIMEOUT_MS = PROPERTY_PREFIX + "contextTimeoutMs";
    public static final String PROPERTY_DEADLINE_MS = PROPERTY_PREFIX + "deadlineMs";
    public static final String PROPERTY_SEED = PROPERTY_PREFIX + "seed";
    public static final String PROPERTY_ZONE = PROPERTY_PREFIX + "zone";
    public static final String PROPERTY_REGION = PROPERTY_PREFIX + "region";

    /** Minimum feasibility a candidate needs to be selected by efficiency. */
    @Builder.Default
    double feasibilityThreshold = DEFAULT_FEASIBILITY_THRESHOLD;

    @Builder.Default
    CostModelConfig costModel = CostModelConfig.defaults();

    @Builder.Default
    SustainabilityConfig sustainability = SustainabilityConfig.defaults();

    @Builder.Default
    SolverSettings solverSettings = SolverSettings.defaults();

    @Builder.Default
    RecommendationConfig recommendation = RecommendationConfig.defaults();

    @Builder.Default
    ScoringCeilings scoringCeilings = ScoringCeilings.defaults();

    @Builder.Default
    MultimodalConfig multimodal = MultimodalConfig.defaults();

    /** Bound applied to each real-time sub-fetch. */
    @Builder.Default
    Duration contextTimeout = DEFAULT_CONTEXT_TIMEOUT;

    /** Whole-call deadline used when the request carries none. */
    @Builder.Default
    Duration defaultDeadline = DEFAULT_DEADLINE;

    @Builder.Default
    ZoneId zoneId = ZoneOffset.UTC;

    @Builder.Default
    String defaultRegion = ContextDefaults.DEFAULT_REGION;

    @Singular
    Set<LocalDate> holidays;

    /** Solvers to run; empty means every registered solver. */
    @Singular
    Set<SolverAlgorithm> enabledAlgorithms;

    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Defaults overridden by {@code optiroute.*} system properties.
     */
    public static OptimizerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Defaults overridden by {@code optiroute.*} entries. Unparsable values keep the default.
     */
    public static OptimizerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        OptimizerConfig defaults = defaults();
        SolverSettings solver = defaults.getSolverSettings().toBuilder()
                .seed(longProperty(properties, PROPERTY_SEED, defaults.getSolverSettings().getSeed()))
                .solverTimeout(millisProperty(
                        properties, PROPERTY_SOLVER_TIMEOUT_MS, defaults.getSolverSettings().getSolverTimeout()))
                .searchTimeLimit(millisProperty(
                        properties, PROPERTY_SEARCH_TIME_LIMIT_MS, defaults.getSolverSettings().getSearchTimeLimit()))
                .build();
        return defaults.toBuilder()
                .feasibilityThreshold(thresholdProperty(properties))
                .solverSettings(solver)
                .contextTimeout(millisProperty(properties, PROPERTY_CONTEXT_TIMEOUT_MS, defaults.getContextTimeout()))
                .defaultDeadline(millisProperty(properties, PROPERTY_DEADLINE_MS, defaults.getDefaultDeadline()))
                .zoneId(zoneProperty(properties, defaults.getZoneId()))
                .defaultRegion(textProperty(properties, PROPERTY_REGION, defaults.getDefaultRegion()))
                .build();
    }

    /**
     * Validates this configuration and every nested one.
     *
     * @return this instance.
     */
    public OptimizerConfig validate() {
        if (!(feasibilityThreshold >= 0.0d && feasibilityThreshold <= 1.0d)) {
            throw new IllegalArgumentException("feasibilityThreshold must be in [0, 1]");
        }
        requirePositive(contextTimeout, "contextTimeout");
        requirePositive(defaultDeadline, "defaultDeadline");
        Objects.requireNonNull(zoneId, "zoneId");
        if (defaultRegion == null || defaultRegion.isBlank()) {
            throw new IllegalArgumentException("defaultRegion must be non-blank");
        }
        Objects.requireNonNull(costModel, "costModel").validate();
        Objects.requireNonNull(sustainability, "sustainability").validate();
        Objects.requireNonNull(solverSettings, "solverSettings").validate();
        Objects.requireNonNull(recommendation, "recommendation").validate();
        Objects.requireNonNull(scoringCeilings, "scoringCeilings").validate();
        Objects.requireNonNull(multimodal, "multimodal").validate();
        return this;
    }

    private static void requirePositive(Duration duration, String field) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(field + " must be > 0");
        }
    }

    private static double thresholdProperty(Properties properties) {
        String raw = properties.getProperty(PROPERTY_FEASIBILITY_THRESHOLD);
        if (raw == null) {
            return DEFAULT_FEASIBILITY_THRESHOLD;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value >= 0.0d && value <= 1.0d) {
                return value;
            }
        } catch (NumberFormatException ignored) {
            // falls through to the default
        }
        log.warn("Ignoring {}={}; using {}", PROPERTY_FEASIBILITY_THRESHOLD, raw, DEFAULT_FEASIBILITY_THRESHOLD);
        return DEFAULT_FEASIBILITY_THRESHOLD;
    }

    private static long longProperty(Properties properties, String key, long fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}; using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static Duration millisProperty(Properties properties, String key, Duration fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            long millis = Long.parseLong(raw.trim());
            if (millis > 0L) {
                return Duration.ofMillis(millis);
            }
        } catch (NumberFormatException ignored) {
            // falls through to the default
        }
        log.warn("Ignoring {}={}; using {}", key, raw, fallback);
        return fallback;
    }

    private static ZoneId zoneProperty(Properties properties, ZoneId fallback) {
        String raw = properties.getProperty(PROPERTY_ZONE);
        if (raw == null) {
            return fallback;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            log.warn("Ignoring {}={}; using {}", PROPERTY_ZONE, raw, fallback);
            return fallback;
        }
    }

    private static String textProperty(Properties properties, String key, String fallback) {
        String raw = properties.getProperty(key);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}
