package io.deadswitch.application.service;

/**
 * Outcome of an operator-driven retry of one logged failure.
 */
public record FailureRetryResult(
        long failureId,
        Outcome outcome,
        int retryCount, // After the attempt
        String error // null when delivered or not attempted
) {
    public enum Outcome {
        DELIVERED,
        FAILED,
        ALREADY_RESOLVED,
        PERMANENT, // Error is not worth resending
        EXHAUSTED, // Type's retry limit reached
        UNSUPPORTED // Original content cannot be rebuilt
    }

    public boolean attempted() {
        return outcome == Outcome.DELIVERED || outcome == Outcome.FAILED;
    }
}
