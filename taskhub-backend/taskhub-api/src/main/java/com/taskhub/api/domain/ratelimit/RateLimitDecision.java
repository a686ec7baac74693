package com.taskhub.api.domain.ratelimit;

/**
 * Outcome of a single check-and-increment.
 */
public record RateLimitDecision(boolean allowed, int limit, long remaining, long retryAfterSeconds) {

    public static RateLimitDecision allowed(int limit, long remaining) {
        return new RateLimitDecision(true, limit, remaining, 0);
    }

    public static RateLimitDecision rejected(int limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, retryAfterSeconds);
    }
}
