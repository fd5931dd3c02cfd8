package io.deadswitch.infrastructure.render;

import io.deadswitch.application.port.output.MessageRenderer.RenderedMessage;
import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.Owner;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.monitoring.FailureSeverity;
import io.deadswitch.support.TestSecrets;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultMessageRendererTest {

    private final DefaultMessageRenderer renderer = new DefaultMessageRenderer("https://switch.example");
    private final Secret secret = TestSecrets.active("s1", "u1", 30, Instant.parse("2024-01-01T00:00:00Z"));
    private final Owner owner = new Owner("u1", "owner@example.com", "Olivia <Owner>");

    @Test
    void urgentReminder() {
        RenderedMessage message = renderer.renderReminder(secret, owner, ReminderTier.TWENTY_FOUR_HOURS,
            "23 hours", "https://switch.example/check-in?token=abc");

        assertEquals("URGENT: Check-in required within 23 hours - Secret s1", message.subject());
        assertTrue(message.html().contains("Time is running out!"));
        assertTrue(message.html().contains("Olivia &lt;Owner&gt;"));
        assertTrue(message.text().contains("https://switch.example/check-in?token=abc"));
    }

    @Test
    void scheduledReminderHasNoUrgencyBanner() {
        RenderedMessage message = renderer.renderReminder(secret, owner, ReminderTier.FIFTY_PERCENT,
            "15 days", "https://switch.example/check-in?token=abc");

        assertEquals("Scheduled: Check-in required within 15 days - Secret s1", message.subject());
        assertFalse(message.html().contains("Time is running out!"));
    }

    @Test
    void reminderRetryKeepsLoggedSubjectAndLinksToSite() {
        EmailFailure failure = new EmailFailure(7, EmailType.REMINDER, "mock", "owner@example.com",
            "Check-in reminder: Secret s1", "Network error", 1, Instant.parse("2024-01-01T00:00:00Z"), null);

        RenderedMessage message = renderer.renderReminderRetry(failure);

        assertEquals("Check-in reminder: Secret s1", message.subject());
        assertTrue(message.html().contains("href=\"https://switch.example\""));
        assertTrue(message.text().contains("https://switch.example"));
        assertFalse(message.text().contains("token="));
    }

    @Test
    void disclosureCarriesShareAndDecryptLink() {
        RenderedMessage message = renderer.renderDisclosure(secret,
            new Recipient("Alice", "alice@example.com", null), owner, "share-123");

        assertEquals("Confidential Message from Olivia <Owner> - Secret s1", message.subject());
        assertTrue(message.text().contains("share-123"));
        assertTrue(message.text().contains("https://switch.example/decrypt"));
        assertTrue(message.html().contains("<pre>share-123</pre>"));
    }

    @Test
    void disclosureWithoutOwnerNameFallsBack() {
        RenderedMessage message = renderer.renderDisclosure(secret,
            new Recipient("Alice", "alice@example.com", null), new Owner("u1", null, null), "share");

        assertTrue(message.subject().startsWith("Confidential Message from A Dead Man's Switch user"));
    }

    @Test
    void adminAlertNamesSeverityAndContext() {
        EmailFailure failure = new EmailFailure(7, EmailType.DISCLOSURE, "sendgrid", "alice@example.com",
            "Confidential", "Network error", 2, Instant.now(), null);

        assertEquals("[CRITICAL] Email Delivery Failure - Secret s1",
            renderer.renderAdminAlert(failure, FailureSeverity.CRITICAL, "Secret s1").subject());
        RenderedMessage noContext = renderer.renderAdminAlert(failure, FailureSeverity.HIGH, null);
        assertEquals("[HIGH] Email Delivery Failure - disclosure", noContext.subject());
        assertTrue(noContext.text().contains("Retry count: 2"));
    }

    @Test
    void escapesHtml() {
        assertEquals("&lt;a href=&quot;x&quot;&gt;&amp;&#39;", DefaultMessageRenderer.escape("<a href=\"x\">&'"));
        assertEquals("", DefaultMessageRenderer.escape(null));
    }
}
