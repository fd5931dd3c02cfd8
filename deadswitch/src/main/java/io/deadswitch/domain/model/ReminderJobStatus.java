package io.deadswitch.domain.model;

/**
 * Outcome recorded for a reminder tier within one check-in cycle.
 */
public enum ReminderJobStatus {
    SENT("sent"),
    FAILED("failed"), // Delivery failed, escalated, not resent this cycle
    CANCELLED("cancelled"); // Superseded by a check-in

    private final String dbValue;

    ReminderJobStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }
}
