package io.deadswitch.domain.model;

import java.time.Instant;

/**
 * Dedupe record: a reminder tier handled for one check-in cycle.
 * Unique on (secretId, tier, cycleStartedAt).
 */
public record ReminderJob(
        String id,
        String secretId,
        ReminderTier tier,
        Instant cycleStartedAt, // lastCheckIn of the cycle it belongs to
        ReminderJobStatus status,
        Instant sentAt,
        Instant failedAt,
        String error
) {
    public static ReminderJob sent(String id, String secretId, ReminderTier tier, Instant cycleStartedAt, Instant now) {
        return new ReminderJob(id, secretId, tier, cycleStartedAt, ReminderJobStatus.SENT, now, null, null);
    }

    public static ReminderJob failed(String id, String secretId, ReminderTier tier, Instant cycleStartedAt,
                                     Instant now, String error) {
        return new ReminderJob(id, secretId, tier, cycleStartedAt, ReminderJobStatus.FAILED, null, now, error);
    }
}
