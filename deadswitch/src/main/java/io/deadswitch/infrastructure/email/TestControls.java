package io.deadswitch.infrastructure.email;

import java.time.Duration;
import java.util.List;

/**
 * Failure injection and inspection for the in-memory provider.
 * Production code never depends on this interface.
 */
public interface TestControls {

    /**
     * Fail the next {@code times} sends with the given kind and message.
     */
    void simulateFailure(EmailSendException.Kind kind, String message, int times);

    void simulateDelay(Duration delay);

    /**
     * While enabled every send is rejected as rate limited.
     */
    void simulateRateLimit(boolean enabled);

    List<EmailData> getSentEmails();

    int getSendCalls();

    void clear();
}
