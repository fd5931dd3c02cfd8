package io.deadswitch.domain.model;

/**
 * Kinds of outbound email, with the operator retry limit for each.
 */
public enum EmailType {
    REMINDER("reminder", 3),
    DISCLOSURE("disclosure", 5),
    ADMIN_NOTIFICATION("admin_notification", 1),
    VERIFICATION("verification", 2);

    private final String dbValue;
    private final int maxRetries;

    EmailType(String dbValue, int maxRetries) {
        this.dbValue = dbValue;
        this.maxRetries = maxRetries;
    }

    public String dbValue() {
        return dbValue;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public static EmailType fromDb(String value) {
        for (EmailType type : values()) {
            if (type.dbValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown email type: " + value);
    }
}
