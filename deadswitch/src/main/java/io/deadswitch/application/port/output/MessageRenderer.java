package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.Owner;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.monitoring.FailureSeverity;

/**
 * Builds subject and bodies for outbound emails.
 */
public interface MessageRenderer {

    record RenderedMessage(String subject, String html, String text) {}

    RenderedMessage renderReminder(Secret secret, Owner owner, ReminderTier tier, String timeRemaining,
                                   String checkInUrl);

    RenderedMessage renderDisclosure(Secret secret, Recipient recipient, Owner owner, String serverShare);

    /**
     * Resend of a logged reminder failure. The original body is not stored, so
     * this links to the site instead of a check-in token.
     */
    RenderedMessage renderReminderRetry(EmailFailure failure);

    RenderedMessage renderAdminAlert(EmailFailure failure, FailureSeverity severity, String contextTitle);
}
