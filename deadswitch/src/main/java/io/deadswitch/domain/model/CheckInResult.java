package io.deadswitch.domain.model;

import java.time.Instant;

/**
 * Outcome of consuming a check-in token: either the new deadline or an error.
 */
public record CheckInResult(
        CheckInError error, // null on success
        String secretTitle,
        Instant nextCheckIn
) {
    public static CheckInResult success(String secretTitle, Instant nextCheckIn) {
        return new CheckInResult(null, secretTitle, nextCheckIn);
    }

    public static CheckInResult failure(CheckInError error) {
        return new CheckInResult(error, null, null);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
