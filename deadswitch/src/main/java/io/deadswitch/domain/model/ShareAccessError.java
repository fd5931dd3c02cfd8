package io.deadswitch.domain.model;

/**
 * Rejections for the server-share read that a consumed token may still authorize.
 */
public enum ShareAccessError {
    INVALID_TOKEN(403, "Invalid or expired token."),
    GRACE_PERIOD_EXPIRED(403, "Token has already been used and the grace period has expired."),
    TOKEN_EXPIRED(403, "Token has expired."),
    SECRET_NOT_FOUND(404, "Secret not found."),
    SECRET_DISABLED(410, "This secret has been disabled. The server share has been deleted and is no longer available.");

    private final int httpStatus;
    private final String message;

    ShareAccessError(int httpStatus, String message) {
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
