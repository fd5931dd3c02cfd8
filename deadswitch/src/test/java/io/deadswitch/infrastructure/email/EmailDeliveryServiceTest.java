package io.deadswitch.infrastructure.email;

import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.infrastructure.metrics.PrometheusSwitchMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailDeliveryServiceTest {

    private InMemoryEmailProvider provider;
    private CollectorRegistry registry;
    private EmailDeliveryService service;

    @BeforeEach
    void setUp() {
        provider = new InMemoryEmailProvider();
        registry = new CollectorRegistry();
        service = new EmailDeliveryService(provider, fastPolicy(), new PrometheusSwitchMetrics(registry),
            "noreply@switch.example", "Dead Man's Switch");
    }

    private static RetryPolicy fastPolicy() {
        return RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(4))
            .maxAttempts(3)
            .jitterRatio(0)
            .build();
    }

    private static EmailData email(String to) {
        return EmailData.builder()
            .to(to)
            .subject("Check-in reminder")
            .text("Please check in")
            .trackDelivery(true)
            .build();
    }

    @Test
    void deliversAndAppliesDefaultSender() {
        EmailResult result = service.send(email("owner@example.com"));

        assertTrue(result.success());
        assertTrue(result.messageId().startsWith("mock-"));
        assertEquals(1, result.attempts());
        assertEquals("mock", result.provider());
        assertTrue(result.trackingEnabled());

        EmailData sent = provider.getSentEmails().get(0);
        assertEquals("noreply@switch.example", sent.from());
        assertEquals("Dead Man's Switch", sent.fromName());
    }

    @Test
    void explicitSenderIsKept() {
        service.send(EmailData.builder()
            .to("owner@example.com")
            .subject("s")
            .html("<p>b</p>")
            .from("alerts@switch.example", "Alerts")
            .build());

        assertEquals("alerts@switch.example", provider.getSentEmails().get(0).from());
    }

    @Test
    @DisplayName("Invalid messages fail with zero attempts and never reach the provider")
    void validationFailureMakesNoAttempt() {
        EmailResult result = service.send(email("not-an-address"));

        assertFalse(result.success());
        assertFalse(result.retryable());
        assertEquals(0, result.attempts());
        assertEquals("Invalid email address: not-an-address", result.error());
        assertEquals(0, provider.getSendCalls());
    }

    @Test
    void validationMessages() {
        assertEquals("Recipient email is required", EmailDeliveryService.validate(email(null)));
        assertEquals("Subject is required", EmailDeliveryService.validate(
            EmailData.builder().to("a@b.co").text("x").build()));
        assertEquals("Email body is required", EmailDeliveryService.validate(
            EmailData.builder().to("a@b.co").subject("s").build()));
        assertNull(EmailDeliveryService.validate(email("a@b.co")));
    }

    @Test
    void authenticationFailureAbortsWithoutRetry() {
        provider.simulateFailure(EmailSendException.Kind.AUTHENTICATION, "Authentication failed (401): bad key", 5);

        EmailResult result = service.send(email("owner@example.com"));

        assertFalse(result.success());
        assertFalse(result.retryable());
        assertEquals(1, result.attempts());
        assertEquals(1, provider.getSendCalls());
    }

    @Test
    void transientFailuresExhaustRetries() {
        provider.simulateFailure(EmailSendException.Kind.NETWORK, "Network error: connection reset", 10);

        EmailResult result = service.send(email("owner@example.com"));

        assertFalse(result.success());
        assertTrue(result.retryable());
        assertEquals(3, result.attempts());
        assertEquals(3, provider.getSendCalls());
        assertEquals(3.0, registry.getSampleValue("deadswitch_email_send_attempts_total",
            new String[]{"provider", "outcome"}, new String[]{"mock", "failure"}));
    }

    @Test
    void recoversAfterTransientFailure() {
        provider.simulateFailure(EmailSendException.Kind.SERVICE_UNAVAILABLE, "SendGrid unavailable (503)", 1);

        EmailResult result = service.send(email("owner@example.com"));

        assertTrue(result.success());
        assertEquals(2, result.attempts());
    }

    @Test
    @DisplayName("A single 429 is retried within the attempt budget")
    void transientRateLimitIsRetried() {
        provider.simulateFailure(EmailSendException.Kind.RATE_LIMITED, "429 Too Many Requests", 1);

        EmailResult result = service.send(email("owner@example.com"));

        assertTrue(result.success());
        assertEquals(2, result.attempts());
        assertEquals(2, provider.getSendCalls());
        assertNull(result.retryAfterSeconds());
        assertEquals(1, provider.getSentEmails().size());
    }

    @Test
    void persistentRateLimitReportsRetryAfterOnceAttemptsRunOut() {
        provider.simulateRateLimit(true);

        EmailResult result = service.send(email("owner@example.com"));

        assertFalse(result.success());
        assertTrue(result.retryable());
        assertEquals(3, result.attempts());
        assertEquals(3, provider.getSendCalls());
        assertEquals(60, result.retryAfterSeconds());
        assertEquals(100, result.rateLimitInfo().limit());
        assertEquals(0, result.rateLimitInfo().remaining());
    }

    @Test
    void rateLimitFollowedByOtherFailureIsNotReportedAsRateLimited() {
        EmailProvider flaky = mock(EmailProvider.class);
        when(flaky.name()).thenReturn("flaky");
        when(flaky.send(any()))
            .thenThrow(EmailSendException.rateLimited("Rate limit exceeded", 1, null))
            .thenThrow(new EmailSendException(EmailSendException.Kind.NETWORK, "Network error: connection reset"))
            .thenThrow(new EmailSendException(EmailSendException.Kind.NETWORK, "Network error: connection reset"));
        EmailDeliveryService flakyService = new EmailDeliveryService(flaky, fastPolicy(),
            new PrometheusSwitchMetrics(new CollectorRegistry()), "a@b.co", null);

        EmailResult result = flakyService.send(email("owner@example.com"));

        assertFalse(result.success());
        assertEquals(3, result.attempts());
        assertNull(result.retryAfterSeconds());
        assertEquals("Network error: connection reset", result.error());
    }

    @Test
    void unknownErrorsAreClassifiedByMessage() {
        provider.simulateFailure(EmailSendException.Kind.UNKNOWN, "Invalid recipient mailbox", 3);

        EmailResult result = service.send(email("owner@example.com"));

        assertFalse(result.retryable());
        assertEquals(1, result.attempts());
    }

    @Test
    void unexpectedRuntimeExceptionsAreRetriedWhenTransient() {
        EmailProvider flaky = mock(EmailProvider.class);
        when(flaky.name()).thenReturn("flaky");
        when(flaky.send(any()))
            .thenThrow(new IllegalStateException("socket timeout"))
            .thenReturn("id-1");
        SwitchMetrics metrics = new PrometheusSwitchMetrics(new CollectorRegistry());
        EmailDeliveryService flakyService = new EmailDeliveryService(flaky, fastPolicy(), metrics, "a@b.co", null);

        EmailResult result = flakyService.send(email("owner@example.com"));

        assertTrue(result.success());
        assertEquals("id-1", result.messageId());
        assertEquals(2, result.attempts());
        assertFalse(result.trackingEnabled());
        verify(flaky, times(2)).send(any());
    }
}
