package com.taskhub.api.domain.exception;

/**
 * Thrown when a client exhausts its request budget for the current window.
 * Mapped to 429 Too Many Requests by GlobalExceptionHandler.
 */
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;
    private final int limit;

    public RateLimitExceededException(String message, long retryAfterSeconds, int limit) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
        this.limit = limit;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public int getLimit() {
        return limit;
    }
}
