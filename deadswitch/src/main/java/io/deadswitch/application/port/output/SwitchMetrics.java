package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.monitoring.FailureSeverity;

import java.time.Duration;

/**
 * Operational counters for the disclosure engine.
 */
public interface SwitchMetrics {

    void recordReminderSent(ReminderTier tier);

    void recordReminderFailed(ReminderTier tier);

    void recordDisclosureTriggered();

    void recordSendAttempt(String provider, boolean success);

    void recordFailureLogged(EmailType type, FailureSeverity severity);

    /**
     * @param outcome "success" or the lowercase CheckInError name
     */
    void recordCheckIn(String outcome);

    void recordSchedulerRun(Duration duration);
}
