package io.deadswitch.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * A deposited secret and its disclosure deadline.
 *
 * The encrypted server share is opaque here. When serverShare, iv or authTag
 * is missing the secret is "disabled": it can never be disclosed.
 */
public record Secret(
        String id,
        String userId, // Owner
        String title,
        List<Recipient> recipients, // Ordered, at least one
        int checkInDays, // Check-in cadence in whole days
        SecretStatus status,
        String serverShare, // Encrypted, base64
        String iv,
        String authTag,
        Instant lastCheckIn,
        Instant nextCheckIn, // Always lastCheckIn + checkInDays * 86400000 ms
        Instant triggeredAt, // Set once on disclosure
        Instant createdAt,
        Instant updatedAt
) {
    public static final long MILLIS_PER_DAY = 86_400_000L;

    public Secret {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public boolean isActive() {
        return status == SecretStatus.ACTIVE;
    }

    public boolean isTriggered() {
        return status == SecretStatus.TRIGGERED;
    }

    /**
     * False when the server share was deleted and disclosure content is gone.
     */
    public boolean hasServerShare() {
        return serverShare != null && iv != null && authTag != null;
    }

    public long intervalMillis() {
        return checkInDays * MILLIS_PER_DAY;
    }

    /**
     * Start of the current check-in cycle, used to key reminder dedupe records.
     */
    public Instant cycleStart() {
        return lastCheckIn != null ? lastCheckIn : createdAt;
    }
}
