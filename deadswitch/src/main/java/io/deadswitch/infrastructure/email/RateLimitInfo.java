package io.deadswitch.infrastructure.email;

import java.time.Instant;

/**
 * Provider quota reported with a rate-limit response.
 */
public record RateLimitInfo(
        int limit,
        int remaining,
        Instant resetTime
) {}
