package io.deadswitch.domain.monitoring;

/**
 * Severity of an email delivery failure.
 */
public enum FailureSeverity {
    /**
     * CRITICAL - a disclosure did not reach a recipient.
     * Operators are notified immediately.
     */
    CRITICAL,

    /**
     * HIGH - a reminder kept failing after repeated attempts.
     * Operators are notified immediately.
     */
    HIGH,

    /**
     * MEDIUM - a reminder failed. Logged only.
     */
    MEDIUM,

    /**
     * LOW - anything else. Logged only.
     */
    LOW;

    public boolean requiresOperatorNotification() {
        return this == CRITICAL || this == HIGH;
    }
}
