package io.deadswitch.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background passes that keep the store tidy, plus an optional in-process
 * reminder run for deployments without an external cron.
 *
 * - Email failure cleanup: every 24h, resolved rows past the retention window
 * - Check-in token purge: every 24h, expired tokens that were never used
 * - Reminder run: every {@code reminderInterval} when enabled
 */
public final class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private static final long INITIAL_DELAY_MINUTES = 1;
    private static final long DAILY_MINUTES = TimeUnit.DAYS.toMinutes(1);

    private final FailureEscalationService escalationService;
    private final CheckInTokenService tokenService;
    private final ReminderScheduler reminderScheduler;
    private final int retentionDays;
    private final Duration reminderInterval; // null = external cron only
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public MaintenanceScheduler(FailureEscalationService escalationService,
                                CheckInTokenService tokenService,
                                ReminderScheduler reminderScheduler,
                                int retentionDays,
                                Duration reminderInterval,
                                Clock clock) {
        this.escalationService = escalationService;
        this.tokenService = tokenService;
        this.reminderScheduler = reminderScheduler;
        this.retentionDays = retentionDays;
        this.reminderInterval = reminderInterval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deadswitch-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("[MAINTENANCE] Starting (failure retention {} days, in-process reminders {})",
            retentionDays, reminderInterval != null ? "every " + reminderInterval.toMinutes() + "m" : "disabled");

        scheduler.scheduleAtFixedRate(this::cleanupFailures, INITIAL_DELAY_MINUTES, DAILY_MINUTES, TimeUnit.MINUTES);
        scheduler.scheduleAtFixedRate(this::purgeTokens, INITIAL_DELAY_MINUTES, DAILY_MINUTES, TimeUnit.MINUTES);
        if (reminderInterval != null) {
            scheduler.scheduleAtFixedRate(this::runReminders, INITIAL_DELAY_MINUTES,
                reminderInterval.toMinutes(), TimeUnit.MINUTES);
        }
    }

    public void stop() {
        log.info("[MAINTENANCE] Stopping...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void cleanupFailures() {
        try {
            escalationService.cleanup(retentionDays);
        } catch (Exception e) {
            log.error("[MAINTENANCE] Email failure cleanup failed: {}", e.getMessage(), e);
        }
    }

    void purgeTokens() {
        try {
            tokenService.purgeExpiredTokens();
        } catch (Exception e) {
            log.error("[MAINTENANCE] Token purge failed: {}", e.getMessage(), e);
        }
    }

    void runReminders() {
        try {
            reminderScheduler.runOnce(clock.instant());
        } catch (Exception e) {
            log.error("[MAINTENANCE] In-process reminder run failed: {}", e.getMessage(), e);
        }
    }
}
