package io.deadswitch.application.service;

import java.time.Instant;

/**
 * Counts for one scheduler run.
 */
public record SchedulerRunSummary(
        int processed, // Candidate secrets evaluated
        int remindersProcessed, // Reminders attempted
        int remindersSent,
        int remindersFailed,
        int disclosuresTriggered,
        int disclosuresFailed, // Secrets with at least one undelivered disclosure
        int secretsSkipped, // Disabled secrets, server share deleted
        int errors, // Secrets whose processing threw or timed out
        boolean alreadyRunning, // Run refused because another was in progress
        Instant timestamp,
        long durationMs
) {
    public static SchedulerRunSummary alreadyRunning(Instant timestamp) {
        return new SchedulerRunSummary(0, 0, 0, 0, 0, 0, 0, 0, true, timestamp, 0);
    }
}
