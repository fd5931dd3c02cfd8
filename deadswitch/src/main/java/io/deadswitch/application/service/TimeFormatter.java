package io.deadswitch.application.service;

import java.time.Duration;

/**
 * Human urgency labels for remaining time.
 *
 * Units always floor, never round: remaining time is understated so a
 * reminder never reads less urgent than it is. 23h59m is "23 hours".
 */
public final class TimeFormatter {

    private static final String LESS_THAN_A_MINUTE = "less than a minute";

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 60 * MINUTE_MS;
    private static final long DAY_MS = 24 * HOUR_MS;

    /**
     * @param fractionalDays Remaining time in days, fractions allowed
     */
    public static String formatRemaining(double fractionalDays) {
        if (!(fractionalDays > 0)) {
            return LESS_THAN_A_MINUTE;
        }
        if (fractionalDays < 1.0 / 24) {
            long minutes = (long) Math.floor(fractionalDays * 1440);
            return minutes == 0 ? LESS_THAN_A_MINUTE : plural(minutes, "minute");
        }
        if (fractionalDays < 1) {
            return plural((long) Math.floor(fractionalDays * 24), "hour");
        }
        return plural((long) Math.floor(fractionalDays), "day");
    }

    /**
     * Elapsed variant: same units applied to the absolute value, suffixed with " ago".
     */
    public static String formatElapsed(double fractionalDays) {
        return formatRemaining(Math.abs(fractionalDays)) + " ago";
    }

    /**
     * Millisecond-exact variant used by the scheduler.
     */
    public static String formatRemaining(Duration remaining) {
        long ms = remaining.toMillis();
        if (ms <= 0) {
            return LESS_THAN_A_MINUTE;
        }
        if (ms < HOUR_MS) {
            long minutes = ms / MINUTE_MS;
            return minutes == 0 ? LESS_THAN_A_MINUTE : plural(minutes, "minute");
        }
        if (ms < DAY_MS) {
            return plural(ms / HOUR_MS, "hour");
        }
        return plural(ms / DAY_MS, "day");
    }

    public static String formatElapsed(Duration elapsed) {
        return formatRemaining(elapsed.abs()) + " ago";
    }

    private static String plural(long n, String unit) {
        return n == 1 ? "1 " + unit : n + " " + unit + "s";
    }

    private TimeFormatter() {}
}
