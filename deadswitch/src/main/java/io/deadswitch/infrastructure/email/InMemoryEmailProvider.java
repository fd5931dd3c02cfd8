package io.deadswitch.infrastructure.email;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-production provider that keeps sent emails in memory.
 */
public final class InMemoryEmailProvider implements EmailProvider, TestControls {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEmailProvider.class);

    public static final String NAME = "mock";

    private static final int RATE_LIMIT_RETRY_AFTER_SECONDS = 60;
    private static final int RATE_LIMIT = 100;

    private final List<EmailData> sentEmails = new CopyOnWriteArrayList<>();
    private final AtomicInteger sendCalls = new AtomicInteger();

    private volatile EmailSendException.Kind failureKind;
    private volatile String failureMessage;
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile Duration delay = Duration.ZERO;
    private volatile boolean rateLimited;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String send(EmailData email) {
        sendCalls.incrementAndGet();

        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmailSendException(EmailSendException.Kind.NETWORK, "Send interrupted", e);
            }
        }

        if (rateLimited) {
            throw EmailSendException.rateLimited("Rate limit exceeded", RATE_LIMIT_RETRY_AFTER_SECONDS,
                new RateLimitInfo(RATE_LIMIT, 0, Instant.now().plusSeconds(RATE_LIMIT_RETRY_AFTER_SECONDS)));
        }

        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new EmailSendException(failureKind, failureMessage);
        }

        sentEmails.add(email);
        String messageId = "mock-" + UUID.randomUUID();
        log.info("[EMAIL MOCK] Sent \"{}\" as {}", email.subject(), messageId);
        return messageId;
    }

    @Override
    public boolean supportsTracking() {
        return true;
    }

    @Override
    public void simulateFailure(EmailSendException.Kind kind, String message, int times) {
        this.failureKind = kind;
        this.failureMessage = message;
        this.failuresRemaining.set(times);
    }

    @Override
    public void simulateDelay(Duration delay) {
        this.delay = delay;
    }

    @Override
    public void simulateRateLimit(boolean enabled) {
        this.rateLimited = enabled;
    }

    @Override
    public List<EmailData> getSentEmails() {
        return new ArrayList<>(sentEmails);
    }

    @Override
    public int getSendCalls() {
        return sendCalls.get();
    }

    @Override
    public void clear() {
        sentEmails.clear();
        sendCalls.set(0);
        failuresRemaining.set(0);
        delay = Duration.ZERO;
        rateLimited = false;
    }
}
