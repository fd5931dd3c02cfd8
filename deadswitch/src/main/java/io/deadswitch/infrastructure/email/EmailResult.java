package io.deadswitch.infrastructure.email;

/**
 * Outcome of EmailDeliveryService.send().
 *
 * attempts counts provider calls actually made: 0 when validation rejected
 * the message before any network I/O.
 */
public record EmailResult(
        boolean success,
        String messageId,
        String provider,
        String error,
        boolean retryable, // Caller may retry later
        Integer retryAfterSeconds, // Provider hint, rate limits only
        int attempts,
        boolean trackingEnabled,
        RateLimitInfo rateLimitInfo
) {
    public static EmailResult delivered(String messageId, String provider, int attempts, boolean trackingEnabled) {
        return new EmailResult(true, messageId, provider, null, false, null, attempts, trackingEnabled, null);
    }

    public static EmailResult failed(String provider, String error, boolean retryable, int attempts,
                                     boolean trackingEnabled) {
        return new EmailResult(false, null, provider, error, retryable, null, attempts, trackingEnabled, null);
    }

    public static EmailResult rateLimited(String provider, String error, int retryAfterSeconds, int attempts,
                                          boolean trackingEnabled, RateLimitInfo rateLimitInfo) {
        return new EmailResult(false, null, provider, error, true, retryAfterSeconds, attempts,
            trackingEnabled, rateLimitInfo);
    }
}
