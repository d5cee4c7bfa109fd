package org.optiroute.routing.model;

import org.optiroute.core.time.TimeUtils;

import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive service time window.
 *
 * @param start earliest service start.
 * @param end latest acceptable arrival.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /**
     * Creates a window from two instants.
     */
    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    /**
     * Returns true when {@code end} is not before {@code start}.
     */
    public boolean isWellFormed() {
        return !end.isBefore(start);
    }

    /**
     * Minutes of waiting incurred when arriving at {@code arrival}; zero once the window is open.
     */
    public double waitingMinutes(Instant arrival) {
        if (!arrival.isBefore(start)) {
            return 0.0d;
        }
        return TimeUtils.minutesBetween(arrival, start);
    }

    /**
     * Minutes by which {@code arrival} misses the window end; zero when on time.
     */
    public double latenessMinutes(Instant arrival) {
        if (!arrival.isAfter(end)) {
            return 0.0d;
        }
        return TimeUtils.minutesBetween(end, arrival);
    }

    /**
     * Minutes left between {@code arrival} and the window end (negative when late).
     */
    public double slackMinutes(Instant arrival) {
        return TimeUtils.minutesBetween(arrival, end);
    }
}
