package org.optiroute.routing.testutil;

import org.optiroute.core.geo.GeoPoint;
import org.optiroute.routing.context.ContextDefaults;
import org.optiroute.routing.context.FuelPrices;
import org.optiroute.routing.context.RealTimeDataProvider;
import org.optiroute.routing.context.Traffic;
import org.optiroute.routing.context.Weather;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Data provider whose answers are swapped in by tests.
 */
public final class ScriptedDataProvider implements RealTimeDataProvider {
    private volatile Supplier<Traffic> traffic = ContextDefaults::traffic;
    private volatile Supplier<Weather> weather = ContextDefaults::weather;
    private volatile Supplier<FuelPrices> fuelPrices = () -> ContextDefaults.fuelPrices("test");
    private final AtomicInteger calls = new AtomicInteger();

    public static ScriptedDataProvider defaults() {
        return new ScriptedDataProvider();
    }

    /**
     * Provider whose every call throws.
     */
    public static ScriptedDataProvider unavailable() {
        return new ScriptedDataProvider()
                .traffic(() -> {
                    throw new IllegalStateException("traffic feed down");
                })
                .weather(() -> {
                    throw new IllegalStateException("weather feed down");
                })
                .fuelPrices(() -> {
                    throw new IllegalStateException("fuel feed down");
                });
    }

    public ScriptedDataProvider traffic(Supplier<Traffic> supplier) {
        this.traffic = supplier;
        return this;
    }

    public ScriptedDataProvider weather(Supplier<Weather> supplier) {
        this.weather = supplier;
        return this;
    }

    public ScriptedDataProvider fuelPrices(Supplier<FuelPrices> supplier) {
        this.fuelPrices = supplier;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Traffic getTraffic(GeoPoint origin, List<GeoPoint> destinations) {
        calls.incrementAndGet();
        return traffic.get();
    }

    @Override
    public Weather getWeather(GeoPoint origin, List<GeoPoint> destinations) {
        calls.incrementAndGet();
        return weather.get();
    }

    @Override
    public FuelPrices getFuelPrices(String region) {
        calls.incrementAndGet();
        return fuelPrices.get();
    }

    /**
     * Supplier that sleeps before answering; used to provoke timeouts.
     */
    public static <T> Supplier<T> slow(long millis, Supplier<T> delegate) {
        return () -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return delegate.get();
        };
    }
}
