package io.deadswitch.infrastructure.email;

/**
 * Failure raised by an EmailProvider for a single send attempt.
 */
public class EmailSendException extends RuntimeException {

    public enum Kind {
        AUTHENTICATION(false),
        INVALID_REQUEST(false),
        RATE_LIMITED(true),
        TIMEOUT(true),
        NETWORK(true),
        SERVICE_UNAVAILABLE(true),
        UNKNOWN(true); // Classified from the message

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Kind kind;
    private final Integer retryAfterSeconds;
    private final RateLimitInfo rateLimitInfo;

    public EmailSendException(Kind kind, String message) {
        this(kind, message, null, null, null);
    }

    public EmailSendException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public EmailSendException(Kind kind, String message, Integer retryAfterSeconds,
                              RateLimitInfo rateLimitInfo, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfterSeconds = retryAfterSeconds;
        this.rateLimitInfo = rateLimitInfo;
    }

    public static EmailSendException rateLimited(String message, int retryAfterSeconds, RateLimitInfo info) {
        return new EmailSendException(Kind.RATE_LIMITED, message, retryAfterSeconds, info, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public RateLimitInfo getRateLimitInfo() {
        return rateLimitInfo;
    }

    /**
     * UNKNOWN failures are judged by their message.
     */
    public boolean isRetryable() {
        if (kind == Kind.UNKNOWN) {
            return RetryPolicy.classify(getMessage()) == RetryPolicy.FailureClass.TRANSIENT;
        }
        return kind.isRetryable();
    }
}
