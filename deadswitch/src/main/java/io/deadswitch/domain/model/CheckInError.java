package io.deadswitch.domain.model;

/**
 * Check-in rejections with the HTTP status and user-facing message for each.
 */
public enum CheckInError {
    MISSING_TOKEN(400, "Missing token"),
    INVALID_TOKEN(400, "Invalid or expired token"),
    TOKEN_EXPIRED(400, "Token has expired"),
    TOKEN_ALREADY_USED(400, "Token has already been used"),
    SECRET_NOT_FOUND(404, "Secret not found"),
    SECRET_ALREADY_TRIGGERED(400, "This secret has already been disclosed");

    private final int httpStatus;
    private final String message;

    CheckInError(int httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String message() {
        return message;
    }
}
