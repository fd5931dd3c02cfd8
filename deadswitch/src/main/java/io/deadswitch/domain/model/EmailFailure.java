package io.deadswitch.domain.model;

import java.time.Instant;

/**
 * Logged delivery failure. retryCount grows with each repeated failure of the
 * same logical send (same type, recipient and subject) until resolved.
 */
public record EmailFailure(
        long id,
        EmailType emailType,
        String provider, // sendgrid, mock
        String recipient,
        String subject,
        String errorMessage,
        int retryCount,
        Instant createdAt,
        Instant resolvedAt // null = unresolved
) {
    public boolean isResolved() {
        return resolvedAt != null;
    }

    public EmailFailure withId(long newId) {
        return new EmailFailure(newId, emailType, provider, recipient, subject, errorMessage,
                retryCount, createdAt, resolvedAt);
    }
}
