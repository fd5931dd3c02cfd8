package io.deadswitch.infrastructure.email;

import io.deadswitch.domain.model.EmailType;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy with exponential backoff and jitter for email delivery.
 *
 * Delay before retry n (n = failed attempts so far) is
 * {@code baseDelay * 2^(n-1) + jitter}, jitter in [0, baseDelay * jitterRatio),
 * capped at maxDelay. Immutable and shared across sender threads.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .maxAttempts(3)
 *     .build();
 *
 * for (int attempt = 1; attempt &lt;= policy.getMaxAttempts(); attempt++) {
 *     try {
 *         return provider.send(email);
 *     } catch (EmailSendException e) {
 *         Thread.sleep(policy.delayBeforeRetry(attempt).toMillis());
 *     }
 * }
 * </pre>
 */
public final class RetryPolicy {

    /**
     * Whether a failure is worth retrying.
     */
    public enum FailureClass {
        PERMANENT,
        TRANSIENT
    }

    private static final List<String> PERMANENT_PATTERNS = List.of(
        "invalid email", "invalid recipient", "bounced", "400", "401", "403",
        "unauthorized", "forbidden", "invalid api key", "authentication failed");

    private static final List<String> TRANSIENT_PATTERNS = List.of(
        "timeout", "timed out", "network", "429", "rate limit", "502", "503", "504",
        "connection refused", "connection reset", "econnrefused", "econnreset", "service unavailable");

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final double jitterRatio;
    private final DoubleSupplier jitterSource;

    private RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts,
                        double jitterRatio, DoubleSupplier jitterSource) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.jitterRatio = jitterRatio;
        this.jitterSource = jitterSource;
    }

    /**
     * @param failedAttempts Attempts made so far, starting at 1
     */
    public Duration delayBeforeRetry(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be >= 1");
        }
        int exponent = Math.min(failedAttempts - 1, 30);
        double exponential = baseDelay.toMillis() * Math.pow(2, exponent);
        double jitter = jitterSource.getAsDouble() * baseDelay.toMillis() * jitterRatio;
        long millis = (long) Math.min(exponential + jitter, maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }

    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Classify a raw provider error message. Unknown errors are transient.
     */
    public static FailureClass classify(String errorMessage) {
        if (errorMessage == null) {
            return FailureClass.TRANSIENT;
        }
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        for (String pattern : PERMANENT_PATTERNS) {
            if (lower.contains(pattern)) {
                return FailureClass.PERMANENT;
            }
        }
        for (String pattern : TRANSIENT_PATTERNS) {
            if (lower.contains(pattern)) {
                return FailureClass.TRANSIENT;
            }
        }
        return FailureClass.TRANSIENT;
    }

    /**
     * Whether an operator-driven retry is still allowed for a logged failure.
     */
    public static boolean canRetry(EmailType type, int retryCount) {
        return retryCount < type.maxRetries();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for outbound email: 3 attempts, 1s base, 60s cap, jitter up to half the base.
     */
    public static RetryPolicy forEmail() {
        return builder().build();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private double jitterRatio = 0.5;
        private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitterRatio(double jitterRatio) {
            if (jitterRatio < 0) {
                throw new IllegalArgumentException("Jitter ratio cannot be negative");
            }
            this.jitterRatio = jitterRatio;
            return this;
        }

        /**
         * Source of values in [0, 1). Tests pass a constant.
         */
        public Builder jitterSource(DoubleSupplier jitterSource) {
            this.jitterSource = jitterSource;
            return this;
        }

        public RetryPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new RetryPolicy(baseDelay, maxDelay, maxAttempts, jitterRatio, jitterSource);
        }
    }
}
