package io.deadswitch.domain.model;

/**
 * Secret lifecycle status.
 *
 * Flow: ACTIVE ⇄ PAUSED, ACTIVE → TRIGGERED (terminal)
 */
public enum SecretStatus {
    ACTIVE("active"), // Deadline is running, scheduler evaluates it
    PAUSED("paused"), // User suspended the timer, scheduler ignores it
    TRIGGERED("triggered"); // Disclosed, no further reminders or check-ins

    private final String dbValue;

    SecretStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static SecretStatus fromDb(String value) {
        for (SecretStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown secret status: " + value);
    }
}
