package org.optiroute.routing.context;

import org.optiroute.core.time.TimeUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable calendar resolver bound to one zone and holiday calendar.
 *
 * <p>Rush hour covers the inclusive hour ranges 07-09 and 17-19. Weekends take the
 * weekend multiplier regardless of hour.</p>
 */
public final class TimeFactorResolver {
    public static final double WEEKEND_MULTIPLIER = 0.8d;
    public static final double MORNING_RUSH_MULTIPLIER = 1.5d;
    public static final double EVENING_RUSH_MULTIPLIER = 1.3d;
    public static final double BASE_MULTIPLIER = 1.0d;

    private static final int MORNING_RUSH_FIRST_HOUR = 7;
    private static final int MORNING_RUSH_LAST_HOUR = 9;
    private static final int EVENING_RUSH_FIRST_HOUR = 17;
    private static final int EVENING_RUSH_LAST_HOUR = 19;

    private final ZoneId zoneId;
    private final Set<LocalDate> holidays;

    /**
     * Creates a resolver.
     *
     * @param zoneId zone in which hour-of-day and weekday are evaluated.
     * @param holidays local dates flagged as holidays (nullable for none).
     */
    public TimeFactorResolver(ZoneId zoneId, Set<LocalDate> holidays) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
    }

    /**
     * Resolves time factors for one instant.
     */
    public TimeFactors resolve(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        int hour = TimeUtils.hourOfDay(instant, zoneId);
        boolean weekend = TimeUtils.isWeekend(instant, zoneId);
        boolean morningRush = hour >= MORNING_RUSH_FIRST_HOUR && hour <= MORNING_RUSH_LAST_HOUR;
        boolean eveningRush = hour >= EVENING_RUSH_FIRST_HOUR && hour <= EVENING_RUSH_LAST_HOUR;

        double multiplier;
        if (weekend) {
            multiplier = WEEKEND_MULTIPLIER;
        } else if (morningRush) {
            multiplier = MORNING_RUSH_MULTIPLIER;
        } else if (eveningRush) {
            multiplier = EVENING_RUSH_MULTIPLIER;
        } else {
            multiplier = BASE_MULTIPLIER;
        }

        return TimeFactors.builder()
                .rushHour(morningRush || eveningRush)
                .weekend(weekend)
                .holiday(holidays.contains(instant.atZone(zoneId).toLocalDate()))
                .trafficMultiplier(multiplier)
                .build();
    }

    /**
     * Returns bound zone id.
     */
    public ZoneId zoneId() {
        return zoneId;
    }
}
