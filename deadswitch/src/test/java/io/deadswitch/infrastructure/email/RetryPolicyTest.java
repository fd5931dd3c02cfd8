package io.deadswitch.infrastructure.email;

import io.deadswitch.domain.model.EmailType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void exponentialBackoffWithoutJitter() {
        RetryPolicy policy = RetryPolicy.builder().jitterSource(() -> 0.0).build();

        assertEquals(Duration.ofSeconds(1), policy.delayBeforeRetry(1));
        assertEquals(Duration.ofSeconds(2), policy.delayBeforeRetry(2));
        assertEquals(Duration.ofSeconds(4), policy.delayBeforeRetry(3));
    }

    @Test
    void delayIsCappedAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.builder()
            .jitterSource(() -> 0.0)
            .maxDelay(Duration.ofSeconds(10))
            .build();

        assertEquals(Duration.ofSeconds(10), policy.delayBeforeRetry(5));
        assertEquals(Duration.ofSeconds(10), policy.delayBeforeRetry(40));
    }

    @Test
    void jitterAddsUpToHalfTheBaseDelay() {
        RetryPolicy policy = RetryPolicy.builder().jitterSource(() -> 0.5).build();

        Duration delay = policy.delayBeforeRetry(1);

        assertEquals(1250, delay.toMillis());
    }

    @Test
    void shouldRetryUntilMaxAttempts() {
        RetryPolicy policy = RetryPolicy.forEmail();

        assertTrue(policy.shouldRetry(0));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void classifiesPermanentAndTransientErrors() {
        assertEquals(RetryPolicy.FailureClass.PERMANENT, RetryPolicy.classify("Invalid email address"));
        assertEquals(RetryPolicy.FailureClass.PERMANENT, RetryPolicy.classify("HTTP 401 Unauthorized"));
        assertEquals(RetryPolicy.FailureClass.PERMANENT, RetryPolicy.classify("Message bounced"));
        assertEquals(RetryPolicy.FailureClass.TRANSIENT, RetryPolicy.classify("Request timed out"));
        assertEquals(RetryPolicy.FailureClass.TRANSIENT, RetryPolicy.classify("ECONNRESET"));
        assertEquals(RetryPolicy.FailureClass.TRANSIENT, RetryPolicy.classify("something odd"));
        assertEquals(RetryPolicy.FailureClass.TRANSIENT, RetryPolicy.classify(null));
    }

    @Test
    void operatorRetryLimitsPerEmailType() {
        assertTrue(RetryPolicy.canRetry(EmailType.DISCLOSURE, 4));
        assertFalse(RetryPolicy.canRetry(EmailType.DISCLOSURE, 5));
        assertFalse(RetryPolicy.canRetry(EmailType.REMINDER, 3));
        assertFalse(RetryPolicy.canRetry(EmailType.ADMIN_NOTIFICATION, 1));
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().baseDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().jitterRatio(-0.1));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .baseDelay(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(1))
            .build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.forEmail().delayBeforeRetry(0));
    }
}
