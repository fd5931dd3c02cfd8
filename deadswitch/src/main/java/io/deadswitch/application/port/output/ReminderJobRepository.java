package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.ReminderJob;
import io.deadswitch.domain.model.ReminderTier;

import java.time.Instant;
import java.util.Set;

/**
 * Repository for reminder_jobs dedupe records.
 *
 * ENFORCEMENT:
 * - Unique constraint: (secret_id, reminder_type, cycle_started_at)
 */
public interface ReminderJobRepository {

    /**
     * Tiers already handled (sent or failed) in the given cycle.
     */
    Set<ReminderTier> findRecordedTiers(String secretId, Instant cycleStartedAt);

    /**
     * Record a terminal outcome. A duplicate for the same key is ignored.
     *
     * @return true if a new record was written
     */
    boolean record(ReminderJob job);
}
