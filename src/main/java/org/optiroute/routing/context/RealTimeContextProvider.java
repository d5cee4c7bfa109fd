package org.optiroute.routing.context;

import lombok.extern.slf4j.Slf4j;
import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.model.RealTimeFactorFlags;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Collects one {@link RealTimeContext} per optimization run.
 *
 * <p>Traffic, weather and fuel-price fetches run concurrently on the injected executor, each
 * bounded by the fetch timeout. A failed fetch is served from the last value that source returned
 * successfully, or from {@link ContextDefaults} when there is none, and the context is marked
 * stale.</p>
 */
@Slf4j
public final class RealTimeContextProvider {
    private final RealTimeDataProvider dataProvider;
    private final Executor executor;
    private final Duration fetchTimeout;
    private final TimeFactorResolver timeFactorResolver;

    private final AtomicReference<Traffic> lastTraffic = new AtomicReference<>();
    private final AtomicReference<Weather> lastWeather = new AtomicReference<>();
    private final Map<String, FuelPrices> lastFuelPrices = new ConcurrentHashMap<>();

    /**
     * Creates a provider.
     *
     * @param dataProvider live data collaborator.
     * @param executor executor used for the concurrent sub-fetches.
     * @param fetchTimeout bound applied to each sub-fetch.
     * @param timeFactorResolver calendar resolver for time factors.
     */
    public RealTimeContextProvider(
            RealTimeDataProvider dataProvider,
            Executor executor,
            Duration fetchTimeout,
            TimeFactorResolver timeFactorResolver
    ) {
        this.dataProvider = Objects.requireNonNull(dataProvider, "dataProvider");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be > 0");
        }
        this.timeFactorResolver = Objects.requireNonNull(timeFactorResolver, "timeFactorResolver");
    }

    /**
     * Collects a context snapshot.
     *
     * @param origin origin coordinates.
     * @param destinations destination coordinates (may be empty).
     * @param region fuel-price region (nullable for the default region).
     * @param instant instant the snapshot describes.
     * @param flags signals to include; excluded signals take neutral values.
     * @return context snapshot; never {@code null}.
     */
    public RealTimeContext collect(
            GeoPoint origin,
            List<GeoPoint> destinations,
            String region,
            Instant instant,
            RealTimeFactorFlags flags
    ) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(instant, "instant");
        List<GeoPoint> targets = destinations == null ? List.of() : List.copyOf(destinations);
        RealTimeFactorFlags effectiveFlags = flags == null ? RealTimeFactorFlags.all() : flags;
        String effectiveRegion = region == null || region.isBlank() ? ContextDefaults.DEFAULT_REGION : region;

        CompletableFuture<Traffic> traffic = effectiveFlags.isIncludeTraffic()
                ? fetch(() -> dataProvider.getTraffic(origin, targets))
                : CompletableFuture.completedFuture(ContextDefaults.traffic());
        CompletableFuture<Weather> weather = effectiveFlags.isIncludeWeather()
                ? fetch(() -> dataProvider.getWeather(origin, targets))
                : CompletableFuture.completedFuture(ContextDefaults.weather());
        CompletableFuture<FuelPrices> fuel = effectiveFlags.isIncludeFuelPrices()
                ? fetch(() -> dataProvider.getFuelPrices(effectiveRegion))
                : CompletableFuture.completedFuture(ContextDefaults.fuelPrices(effectiveRegion));

        Set<ContextSource> degraded = EnumSet.noneOf(ContextSource.class);
        Traffic resolvedTraffic = join(traffic, ContextSource.TRAFFIC, degraded);
        if (resolvedTraffic == null) {
            resolvedTraffic = fallback(lastTraffic.get(), ContextDefaults.traffic());
        } else if (effectiveFlags.isIncludeTraffic()) {
            lastTraffic.set(resolvedTraffic);
        }

        Weather resolvedWeather = join(weather, ContextSource.WEATHER, degraded);
        if (resolvedWeather == null) {
            resolvedWeather = fallback(lastWeather.get(), ContextDefaults.weather());
        } else if (effectiveFlags.isIncludeWeather()) {
            lastWeather.set(resolvedWeather);
        }

        FuelPrices resolvedFuel = join(fuel, ContextSource.FUEL_PRICES, degraded);
        if (resolvedFuel == null) {
            resolvedFuel = fallback(lastFuelPrices.get(effectiveRegion), ContextDefaults.fuelPrices(effectiveRegion));
        } else if (effectiveFlags.isIncludeFuelPrices()) {
            lastFuelPrices.put(effectiveRegion, resolvedFuel);
        }

        TimeFactors timeFactors = effectiveFlags.isIncludeTimeOfDay()
                ? timeFactorResolver.resolve(instant)
                : TimeFactors.neutral();

        if (!degraded.isEmpty()) {
            log.warn("Real-time context degraded for sources {}; using fallback values", degraded);
        }

        return RealTimeContext.builder()
                .traffic(resolvedTraffic)
                .weather(resolvedWeather)
                .fuelPrices(resolvedFuel)
                .timeFactors(timeFactors)
                .capturedAt(instant)
                .stale(!degraded.isEmpty())
                .degradedSources(degraded)
                .build();
    }

    private <T> CompletableFuture<T> fetch(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, executor)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static <T> T join(CompletableFuture<T> future, ContextSource source, Set<ContextSource> degraded) {
        try {
            T value = future.join();
            if (value == null) {
                log.warn("Real-time source {} returned no data", source);
                degraded.add(source);
            }
            return value;
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof TimeoutException) {
                log.warn("Real-time source {} timed out", source);
            } else {
                log.warn("Real-time source {} failed: {}", source, cause.toString());
            }
            degraded.add(source);
            return null;
        }
    }

    private static <T> T fallback(T lastKnownGood, T defaults) {
        return lastKnownGood != null ? lastKnownGood : defaults;
    }
}
