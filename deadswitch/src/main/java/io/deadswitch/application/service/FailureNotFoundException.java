package io.deadswitch.application.service;

/**
 * Thrown when an email failure id does not exist.
 */
public class FailureNotFoundException extends RuntimeException {

    private final long failureId;

    public FailureNotFoundException(long failureId) {
        super(String.format("[email_failure:%d] Email failure not found", failureId));
        this.failureId = failureId;
    }

    public long getFailureId() {
        return failureId;
    }
}
