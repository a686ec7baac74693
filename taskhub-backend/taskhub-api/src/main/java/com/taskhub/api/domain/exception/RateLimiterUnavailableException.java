package com.taskhub.api.domain.exception;

/**
 * Thrown when the rate-limit counter store cannot be reached and fail-open is disabled.
 * Mapped to 503 Service Unavailable by GlobalExceptionHandler.
 */
public class RateLimiterUnavailableException extends RuntimeException {

    public RateLimiterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
