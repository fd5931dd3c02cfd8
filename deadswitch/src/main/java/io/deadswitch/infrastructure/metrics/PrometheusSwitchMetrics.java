package io.deadswitch.infrastructure.metrics;

import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.monitoring.FailureSeverity;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of SwitchMetrics.
 *
 * Key Metrics:
 * - deadswitch_reminders_sent_total{tier}
 * - deadswitch_reminders_failed_total{tier}
 * - deadswitch_disclosures_triggered_total
 * - deadswitch_email_send_attempts_total{provider, outcome}
 * - deadswitch_email_failures_recorded_total{type, severity}
 * - deadswitch_checkins_total{outcome}
 * - deadswitch_scheduler_run_seconds
 */
public class PrometheusSwitchMetrics implements SwitchMetrics {

    private final CollectorRegistry registry;

    private final Counter remindersSent;
    private final Counter remindersFailed;
    private final Counter disclosuresTriggered;
    private final Counter sendAttempts;
    private final Counter failuresRecorded;
    private final Counter checkIns;
    private final Histogram schedulerRun;

    public PrometheusSwitchMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSwitchMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.remindersSent = Counter.build()
            .name("deadswitch_reminders_sent_total")
            .help("Reminder emails delivered")
            .labelNames("tier")
            .register(registry);

        this.remindersFailed = Counter.build()
            .name("deadswitch_reminders_failed_total")
            .help("Reminder emails that failed after retries")
            .labelNames("tier")
            .register(registry);

        this.disclosuresTriggered = Counter.build()
            .name("deadswitch_disclosures_triggered_total")
            .help("Secrets moved to triggered")
            .register(registry);

        this.sendAttempts = Counter.build()
            .name("deadswitch_email_send_attempts_total")
            .help("Provider send attempts")
            .labelNames("provider", "outcome")
            .register(registry);

        this.failuresRecorded = Counter.build()
            .name("deadswitch_email_failures_recorded_total")
            .help("Email failures logged for escalation")
            .labelNames("type", "severity")
            .register(registry);

        this.checkIns = Counter.build()
            .name("deadswitch_checkins_total")
            .help("Check-in attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.schedulerRun = Histogram.build()
            .name("deadswitch_scheduler_run_seconds")
            .help("Scheduler run duration in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 30.0, 60.0, 120.0)
            .register(registry);
    }

    @Override
    public void recordReminderSent(ReminderTier tier) {
        remindersSent.labels(tier.dbValue()).inc();
    }

    @Override
    public void recordReminderFailed(ReminderTier tier) {
        remindersFailed.labels(tier.dbValue()).inc();
    }

    @Override
    public void recordDisclosureTriggered() {
        disclosuresTriggered.inc();
    }

    @Override
    public void recordSendAttempt(String provider, boolean success) {
        sendAttempts.labels(provider, success ? "success" : "failure").inc();
    }

    @Override
    public void recordFailureLogged(EmailType type, FailureSeverity severity) {
        failuresRecorded.labels(type.dbValue(), severity.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordCheckIn(String outcome) {
        checkIns.labels(outcome).inc();
    }

    @Override
    public void recordSchedulerRun(Duration duration) {
        schedulerRun.observe(duration.toMillis() / 1000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
