package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.CheckInToken;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for check_in_tokens.
 *
 * ENFORCEMENT:
 * - Unique constraint on token
 * - used_at is set by a conditional update (used_at IS NULL), first writer wins
 */
public interface CheckInTokenRepository {

    /**
     * Result of the atomic consume transaction.
     */
    enum ConsumeOutcome {
        CONSUMED, // Token marked used, deadline reset, history written
        ALREADY_USED, // Another request consumed the token first
        SECRET_TRIGGERED // Secret was disclosed meanwhile, nothing changed
    }

    Optional<CheckInToken> findByToken(String token);

    void insert(CheckInToken token);

    /**
     * Consume a token and reset its secret's deadline in one transaction.
     *
     * Steps, rolled back together on any failure:
     * 1. Mark the token used where used_at IS NULL
     * 2. Set last_check_in/next_check_in on the secret unless it is triggered
     * 3. Append a checkin_history row
     * 4. Cancel reminder_jobs of earlier cycles
     */
    ConsumeOutcome consume(String token, String secretId, String userId, Instant now, Instant nextCheckIn);

    /**
     * Set used_at if it is still null. Used by the share-read path, never
     * touches the deadline.
     *
     * @return true if this call set used_at
     */
    boolean markUsedIfUnused(String token, Instant now);

    /**
     * Delete tokens that expired before {@code now} and were never used.
     *
     * @return Number of rows deleted
     */
    int deleteExpiredUnused(Instant now);
}
