package org.optiroute.core.time;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Shared deterministic time helpers for route timelines and temporal factors.
 *
 * <p>Route timelines are computed in fractional minutes and materialized as {@link Instant}s
 * with millisecond precision.</p>
 */
public final class TimeUtils {

    private static final double MILLIS_PER_MINUTE = 60_000.0d;
    private static final double MINUTES_PER_HOUR = 60.0d;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Shifts an instant by fractional minutes, rounded to the nearest millisecond.
     *
     * @param base base instant.
     * @param minutes minutes delta (can be negative).
     * @return shifted instant.
     */
    public static Instant plusMinutes(Instant base, double minutes) {
        if (!Double.isFinite(minutes)) {
            throw new IllegalArgumentException("minutes must be finite, got " + minutes);
        }
        return base.plusMillis(Math.round(minutes * MILLIS_PER_MINUTE));
    }

    /**
     * Returns fractional minutes elapsed from {@code from} to {@code to}.
     */
    public static double minutesBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_MINUTE;
    }

    /**
     * Converts travel distance at a constant speed into minutes.
     *
     * @param distanceKm distance in kilometers.
     * @param speedKmh speed in km/h; must be positive.
     * @return travel time in minutes.
     */
    public static double travelMinutes(double distanceKm, double speedKmh) {
        if (speedKmh <= 0.0d || !Double.isFinite(speedKmh)) {
            throw new IllegalArgumentException("speedKmh must be positive and finite, got " + speedKmh);
        }
        return distanceKm / speedKmh * MINUTES_PER_HOUR;
    }

    /**
     * Converts minutes into fractional hours.
     */
    public static double minutesToHours(double minutes) {
        return minutes / MINUTES_PER_HOUR;
    }

    /**
     * Returns the local hour-of-day of an instant in the given zone.
     */
    public static int hourOfDay(Instant instant, ZoneId zone) {
        return ZonedDateTime.ofInstant(instant, zone).getHour();
    }

    /**
     * Returns true for Saturday and Sunday in the given zone.
     */
    public static boolean isWeekend(Instant instant, ZoneId zone) {
        DayOfWeek day = ZonedDateTime.ofInstant(instant, zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * Validates FIFO property: arrival times must be monotonically non-decreasing.
     *
     * @param arrivalTimes arrival timeline to validate.
     * @return {@code true} when FIFO ordering is preserved; otherwise {@code false}.
     */
    public static boolean validateFIFO(List<Instant> arrivalTimes) {
        if (arrivalTimes == null || arrivalTimes.size() < 2) {
            return true;
        }

        for (int i = 1; i < arrivalTimes.size(); i++) {
            if (arrivalTimes.get(i).isBefore(arrivalTimes.get(i - 1))) {
                return false;
            }
        }

        return true;
    }
}
