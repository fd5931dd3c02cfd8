package io.deadswitch.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Single-use credential that resets a secret's deadline.
 *
 * Purpose:
 * - First consumption resets lastCheckIn/nextCheckIn (exactly once)
 * - After consumption the token still authorizes a read-only server-share
 *   retrieval for GRACE_PERIOD
 * - Rejected from expiresAt on, regardless of usedAt. expiresAt is the
 *   secret's deadline, the same instant at which disclosure becomes due
 */
public record CheckInToken(
        String id,
        String secretId,
        String token, // Random, URL-safe
        Instant expiresAt,
        Instant usedAt, // null = not consumed yet
        Instant createdAt
) {
    public static final Duration GRACE_PERIOD = Duration.ofHours(24);

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    /**
     * True while a consumed token may still be used for the share read.
     */
    public boolean isWithinGracePeriod(Instant now) {
        return usedAt != null && !now.isAfter(usedAt.plus(GRACE_PERIOD));
    }
}
