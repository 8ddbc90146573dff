package com.github.dimitryivaniuta.temporalcache.policy;

import lombok.Builder;

import java.time.Duration;

/**
 * Time window split into calendar-ish components.
 * Fixed conversion: a month is 30 days, a year is 365 days.
 */
@Builder
public record DurationSpec(long seconds,
                           long minutes,
                           long hours,
                           long days,
                           long weeks,
                           long months,
                           long years) {

    public static final DurationSpec ZERO = new DurationSpec(0, 0, 0, 0, 0, 0, 0);

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long MONTH = 30 * DAY;
    private static final long YEAR = 365 * DAY;

    public DurationSpec {
        requireNonNegative("seconds", seconds);
        requireNonNegative("minutes", minutes);
        requireNonNegative("hours", hours);
        requireNonNegative("days", days);
        requireNonNegative("weeks", weeks);
        requireNonNegative("months", months);
        requireNonNegative("years", years);
        total(seconds, minutes, hours, days, weeks, months, years);
    }

    public static DurationSpec ofSeconds(long seconds) {
        return builder().seconds(seconds).build();
    }

    public long totalSeconds() {
        return total(seconds, minutes, hours, days, weeks, months, years);
    }

    public Duration toDuration() {
        return Duration.ofSeconds(totalSeconds());
    }

    public boolean isZero() {
        return totalSeconds() == 0;
    }

    private static long total(long seconds, long minutes, long hours, long days, long weeks, long months, long years) {
        try {
            long t = seconds;
            t = Math.addExact(t, Math.multiplyExact(minutes, MINUTE));
            t = Math.addExact(t, Math.multiplyExact(hours, HOUR));
            t = Math.addExact(t, Math.multiplyExact(days, DAY));
            t = Math.addExact(t, Math.multiplyExact(weeks, WEEK));
            t = Math.addExact(t, Math.multiplyExact(months, MONTH));
            return Math.addExact(t, Math.multiplyExact(years, YEAR));
        } catch (ArithmeticException ex) {
            throw new CacheConfigurationException("Duration overflows: " + seconds + "s " + minutes + "m " + hours + "h "
                    + days + "d " + weeks + "w " + months + "mo " + years + "y", ex);
        }
    }

    private static void requireNonNegative(String component, long value) {
        if (value < 0) {
            throw new CacheConfigurationException("Duration component '" + component + "' must be >= 0, got " + value);
        }
    }
}
