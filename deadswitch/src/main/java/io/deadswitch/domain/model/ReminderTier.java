package io.deadswitch.domain.model;

import java.time.Duration;

/**
 * Reminder urgency buckets, declared from most to least urgent.
 *
 * Fixed tiers fire when the remaining time drops to their threshold.
 * Percentage tiers fire when the remaining share of the check-in interval
 * drops to their percentage.
 */
public enum ReminderTier {
    CRITICAL("critical", Duration.ofMinutes(15), 0, "CRITICAL"),
    ONE_HOUR("1_hour", Duration.ofHours(1), 0, "CRITICAL"),
    TWELVE_HOURS("12_hours", Duration.ofHours(12), 0, "URGENT"),
    TWENTY_FOUR_HOURS("24_hours", Duration.ofHours(24), 0, "URGENT"),
    THREE_DAYS("3_days", Duration.ofDays(3), 0, "Important"),
    SEVEN_DAYS("7_days", Duration.ofDays(7), 0, "Important"),
    TWENTY_FIVE_PERCENT("25_percent", null, 25, "Scheduled"),
    FIFTY_PERCENT("50_percent", null, 50, "Scheduled");

    private final String dbValue;
    private final Duration threshold;
    private final int percentRemaining;
    private final String urgencyLabel;

    ReminderTier(String dbValue, Duration threshold, int percentRemaining, String urgencyLabel) {
        this.dbValue = dbValue;
        this.threshold = threshold;
        this.percentRemaining = percentRemaining;
        this.urgencyLabel = urgencyLabel;
    }

    public String dbValue() {
        return dbValue;
    }

    public String urgencyLabel() {
        return urgencyLabel;
    }

    public boolean isPercentage() {
        return threshold == null;
    }

    /**
     * Remaining-time threshold for a secret with the given interval.
     */
    public long thresholdMillis(long intervalMillis) {
        if (isPercentage()) {
            return intervalMillis * percentRemaining / 100;
        }
        return threshold.toMillis();
    }

    /**
     * Fixed tiers only apply when they are shorter than the interval,
     * otherwise they would fire the moment a cycle starts.
     */
    public boolean appliesTo(long intervalMillis) {
        return isPercentage() || threshold.toMillis() < intervalMillis;
    }

    public static ReminderTier fromDb(String value) {
        for (ReminderTier tier : values()) {
            if (tier.dbValue.equals(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown reminder tier: " + value);
    }
}
