package io.deadswitch.infrastructure.email;

import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Provider-agnostic email sending with validation, retry and result classification.
 *
 * - Invalid messages fail with attempts = 0 and never reach the provider
 * - Authentication and invalid-request errors abort at once, not retryable
 * - Rate limits and other transient errors are retried with backoff up to the
 *   policy's max attempts. After a rate limit the wait is at least the
 *   provider's retryAfter, capped at the policy's max delay
 *
 * Backoff sleeps block the calling thread. Callers run sends on a worker
 * pool with an overall timeout.
 */
public final class EmailDeliveryService {
    private static final Logger log = LoggerFactory.getLogger(EmailDeliveryService.class);

    private static final int DEFAULT_RETRY_AFTER_SECONDS = 60;
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final EmailProvider provider;
    private final RetryPolicy retryPolicy;
    private final SwitchMetrics metrics;
    private final String defaultFrom;
    private final String defaultFromName;

    public EmailDeliveryService(EmailProvider provider, RetryPolicy retryPolicy, SwitchMetrics metrics,
                                String defaultFrom, String defaultFromName) {
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.defaultFrom = defaultFrom;
        this.defaultFromName = defaultFromName;
    }

    public String providerName() {
        return provider.name();
    }

    public EmailResult send(EmailData email) {
        boolean tracking = email.trackDelivery() && provider.supportsTracking();

        String validationError = validate(email);
        if (validationError != null) {
            log.warn("[EMAIL] Validation failed for {}: {}", LogSanitizer.email(email.to()), validationError);
            return EmailResult.failed(provider.name(), validationError, false, 0, tracking);
        }

        EmailData prepared = email.from() == null ? email.withSender(defaultFrom, defaultFromName) : email;

        int attempts = 0;
        String lastError = null;
        Integer retryAfter = null; // Set while the latest failure is a rate limit
        RateLimitInfo rateLimitInfo = null;
        while (retryPolicy.shouldRetry(attempts)) {
            attempts++;
            try {
                String messageId = provider.send(prepared);
                metrics.recordSendAttempt(provider.name(), true);
                log.info("[EMAIL] ✓ Sent \"{}\" to {} via {} (attempt {})",
                    prepared.subject(), LogSanitizer.email(prepared.to()), provider.name(), attempts);
                return EmailResult.delivered(messageId, provider.name(), attempts, tracking);

            } catch (EmailSendException e) {
                metrics.recordSendAttempt(provider.name(), false);
                lastError = e.getMessage();
                retryAfter = null;
                rateLimitInfo = null;

                if (e.getKind() == EmailSendException.Kind.RATE_LIMITED) {
                    retryAfter = e.getRetryAfterSeconds() != null
                        ? e.getRetryAfterSeconds() : DEFAULT_RETRY_AFTER_SECONDS;
                    rateLimitInfo = e.getRateLimitInfo();
                    log.warn("[EMAIL] Rate limited by {}, retry after {}s", provider.name(), retryAfter);
                } else if (!e.isRetryable()) {
                    log.error("[EMAIL] Permanent failure sending to {} via {}: {}",
                        LogSanitizer.email(prepared.to()), provider.name(), lastError);
                    return EmailResult.failed(provider.name(), lastError, false, attempts, tracking);
                }

            } catch (RuntimeException e) {
                metrics.recordSendAttempt(provider.name(), false);
                retryAfter = null;
                rateLimitInfo = null;
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                if (RetryPolicy.classify(lastError) == RetryPolicy.FailureClass.PERMANENT) {
                    log.error("[EMAIL] Permanent failure from {}: {}", provider.name(), lastError, e);
                    return EmailResult.failed(provider.name(), lastError, false, attempts, tracking);
                }
                log.warn("[EMAIL] Unexpected error from {}: {}", provider.name(), lastError, e);
            }

            if (!retryPolicy.shouldRetry(attempts)) {
                break;
            }
            Duration delay = retryPolicy.delayBeforeRetry(attempts);
            if (retryAfter != null) {
                Duration hint = Duration.ofSeconds(retryAfter);
                if (hint.compareTo(retryPolicy.getMaxDelay()) > 0) {
                    hint = retryPolicy.getMaxDelay();
                }
                if (hint.compareTo(delay) > 0) {
                    delay = hint;
                }
            }
            log.warn("[EMAIL] Attempt {}/{} to {} failed: {}. Retrying in {}ms",
                attempts, retryPolicy.getMaxAttempts(), LogSanitizer.email(prepared.to()), lastError, delay.toMillis());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[EMAIL] Interrupted during backoff after {} attempts", attempts);
                return EmailResult.failed(provider.name(), "Interrupted: " + lastError, true, attempts, tracking);
            }
        }

        log.error("[EMAIL] Giving up on {} after {} attempts: {}",
            LogSanitizer.email(prepared.to()), attempts, lastError);
        if (retryAfter != null) {
            return EmailResult.rateLimited(provider.name(), lastError, retryAfter, attempts, tracking, rateLimitInfo);
        }
        return EmailResult.failed(provider.name(), lastError, true, attempts, tracking);
    }

    /**
     * @return Error message, or null when the message is sendable
     */
    static String validate(EmailData email) {
        if (email.to() == null || email.to().isBlank()) {
            return "Recipient email is required";
        }
        if (!EMAIL_PATTERN.matcher(email.to().trim()).matches()) {
            return "Invalid email address: " + email.to();
        }
        if (email.subject() == null || email.subject().isBlank()) {
            return "Subject is required";
        }
        boolean hasHtml = email.html() != null && !email.html().isBlank();
        boolean hasText = email.text() != null && !email.text().isBlank();
        if (!hasHtml && !hasText) {
            return "Email body is required";
        }
        return null;
    }
}
