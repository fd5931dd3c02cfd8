package io.deadswitch.application.service;

import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;

/**
 * Secret lifecycle and deadline arithmetic.
 *
 * <pre>
 * ACTIVE  → ACTIVE     check-in resets the deadline
 * ACTIVE  ⇄ PAUSED     user controlled, never scheduled
 * ACTIVE  → TRIGGERED  deadline missed, terminal
 * </pre>
 *
 * Deadlines are plain millisecond offsets, so DST and calendar changes never shift them.
 */
public final class DisclosureStateMachine {

    /**
     * nextCheckIn for a check-in made at {@code checkIn}.
     */
    public Instant nextCheckInAfter(Instant checkIn, int checkInDays) {
        if (checkInDays <= 0) {
            throw new IllegalArgumentException("checkInDays must be positive: " + checkInDays);
        }
        return checkIn.plusMillis(checkInDays * Secret.MILLIS_PER_DAY);
    }

    /**
     * Only active secrets are evaluated. Paused and triggered ones are skipped entirely.
     */
    public boolean isSchedulable(Secret secret) {
        return secret.isActive() && secret.nextCheckIn() != null;
    }

    public boolean isDisclosureDue(Secret secret, Instant now) {
        return isSchedulable(secret) && !now.isBefore(secret.nextCheckIn());
    }

    public Optional<ReminderTier> dueReminderTier(Secret secret, Instant now) {
        return dueReminderTier(secret, now, Set.of());
    }

    /**
     * Most urgent tier whose threshold has been crossed, unless that tier was
     * already handled this cycle. Never falls back to a less urgent tier.
     * Urgency is the tier's threshold for this interval, so a percentage tier
     * can rank ahead of a fixed one; ties keep declaration order.
     *
     * @param alreadySent Tiers recorded for the secret's current cycle
     */
    public Optional<ReminderTier> dueReminderTier(Secret secret, Instant now, Set<ReminderTier> alreadySent) {
        if (!isSchedulable(secret)) {
            return Optional.empty();
        }
        long remaining = secret.nextCheckIn().toEpochMilli() - now.toEpochMilli();
        if (remaining <= 0) {
            return Optional.empty(); // disclosure, not a reminder
        }
        long interval = secret.intervalMillis();
        Optional<ReminderTier> crossed = Arrays.stream(ReminderTier.values())
            .filter(tier -> tier.appliesTo(interval))
            .sorted(Comparator.comparingLong((ReminderTier tier) -> tier.thresholdMillis(interval)))
            .filter(tier -> remaining <= tier.thresholdMillis(interval))
            .findFirst();
        return crossed.filter(tier -> !alreadySent.contains(tier));
    }

    public Duration remaining(Secret secret, Instant now) {
        return Duration.between(now, secret.nextCheckIn());
    }

    public double fractionalDaysRemaining(Secret secret, Instant now) {
        return remaining(secret, now).toMillis() / (double) Secret.MILLIS_PER_DAY;
    }

    /**
     * Validate a status change.
     *
     * @throws IllegalStateException for any transition out of TRIGGERED or
     *                               from PAUSED straight to TRIGGERED
     */
    public SecretStatus transition(SecretStatus from, SecretStatus to) {
        boolean allowed = switch (from) {
            case ACTIVE -> true;
            case PAUSED -> to == SecretStatus.PAUSED || to == SecretStatus.ACTIVE;
            case TRIGGERED -> false;
        };
        if (!allowed) {
            throw new IllegalStateException("Illegal secret transition " + from + " → " + to);
        }
        return to;
    }
}
