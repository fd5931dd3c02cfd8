package io.deadswitch.infrastructure.render;

import io.deadswitch.application.port.output.MessageRenderer;
import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.Owner;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.monitoring.FailureSeverity;

/**
 * Plain HTML and text bodies for reminder, disclosure and operator emails.
 * All user-supplied values are HTML-escaped.
 */
public final class DefaultMessageRenderer implements MessageRenderer {

    private static final String UNKNOWN_SENDER = "A Dead Man's Switch user";

    private final String siteUrl;

    public DefaultMessageRenderer(String siteUrl) {
        this.siteUrl = siteUrl;
    }

    @Override
    public RenderedMessage renderReminder(Secret secret, Owner owner, ReminderTier tier, String timeRemaining,
                                          String checkInUrl) {
        String subject = tier.urgencyLabel() + ": Check-in required within " + timeRemaining + " - " + secret.title();
        boolean urgent = tier.ordinal() <= ReminderTier.TWENTY_FOUR_HOURS.ordinal();

        StringBuilder html = new StringBuilder()
            .append("<h2>Check-in Reminder</h2>")
            .append("<p>Hi ").append(escape(owner.displayName())).append(",</p>")
            .append("<p>You need to check in for <strong>").append(escape(secret.title()))
            .append("</strong> within ").append(escape(timeRemaining)).append(".</p>");
        if (urgent) {
            html.append("<p><strong>Time is running out!</strong> Please check in immediately to prevent automatic disclosure.</p>");
        }
        html.append("<p><a href=\"").append(escape(checkInUrl)).append("\">Check In Now</a></p>")
            .append("<p>If you don't check in on time, your secret will be disclosed to your designated contacts.</p>")
            .append("<p>").append(escape(checkInUrl)).append("</p>");

        String text = "Hi " + owner.displayName() + ",\n\n"
            + "You need to check in for \"" + secret.title() + "\" within " + timeRemaining + ".\n\n"
            + "Check in: " + checkInUrl + "\n\n"
            + "If you don't check in on time, your secret will be disclosed to your designated contacts.\n";

        return new RenderedMessage(subject, html.toString(), text);
    }

    @Override
    public RenderedMessage renderDisclosure(Secret secret, Recipient recipient, Owner owner, String serverShare) {
        String sender = owner != null && owner.displayName() != null ? owner.displayName() : UNKNOWN_SENDER;
        String decryptUrl = siteUrl + "/decrypt";
        String subject = "Confidential Message from " + sender + " - " + secret.title();

        String html = "<h2>Confidential Information</h2>"
            + "<p>Dear " + escape(recipient.name()) + ",</p>"
            + "<p>" + escape(sender) + " has not checked in as scheduled.</p>"
            + "<p><strong>Secret:</strong> " + escape(secret.title()) + "</p>"
            + "<h3>Your Secret Share</h3>"
            + "<pre>" + escape(serverShare) + "</pre>"
            + "<p>Combine this share with the one you received from " + escape(sender)
            + " at <a href=\"" + escape(decryptUrl) + "\">" + escape(decryptUrl) + "</a>.</p>";

        String text = "Dear " + recipient.name() + ",\n\n"
            + sender + " has not checked in as scheduled.\n\n"
            + "Secret: " + secret.title() + "\n\n"
            + "Your secret share:\n" + serverShare + "\n\n"
            + "Combine it with the share you received from " + sender + " at " + decryptUrl + "\n";

        return new RenderedMessage(subject, html, text);
    }

    @Override
    public RenderedMessage renderReminderRetry(EmailFailure failure) {
        String html = "<h2>Check-in Reminder</h2>"
            + "<p>We could not deliver an earlier check-in reminder to you.</p>"
            + "<p>Please sign in at <a href=\"" + escape(siteUrl) + "\">" + escape(siteUrl) + "</a>"
            + " and check in before your deadline to prevent automatic disclosure.</p>";

        String text = "We could not deliver an earlier check-in reminder to you.\n\n"
            + "Please sign in at " + siteUrl + " and check in before your deadline"
            + " to prevent automatic disclosure.\n";

        return new RenderedMessage(failure.subject(), html, text);
    }

    @Override
    public RenderedMessage renderAdminAlert(EmailFailure failure, FailureSeverity severity, String contextTitle) {
        String about = contextTitle != null ? contextTitle : failure.emailType().dbValue();
        String subject = "[" + severity.name() + "] Email Delivery Failure - " + about;

        String text = "Email type: " + failure.emailType().dbValue() + "\n"
            + "Provider: " + failure.provider() + "\n"
            + "Recipient: " + failure.recipient() + "\n"
            + "Subject: " + failure.subject() + "\n"
            + "Error: " + failure.errorMessage() + "\n"
            + "Retry count: " + failure.retryCount() + "\n"
            + "Failure id: " + failure.id() + "\n";

        String html = "<h2>Email Delivery Failure (" + severity.name() + ")</h2><pre>" + escape(text) + "</pre>";
        return new RenderedMessage(subject, html, text);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
