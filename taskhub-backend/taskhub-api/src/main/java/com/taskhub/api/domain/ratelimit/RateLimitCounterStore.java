package com.taskhub.api.domain.ratelimit;

import java.time.Duration;

/**
 * Shared counter backend for fixed-window rate limiting.
 * Implementations must increment atomically; callers never read-modify-write.
 */
public interface RateLimitCounterStore {

    /**
     * Atomically increment the counter stored under {@code key} and return the new value.
     * A counter created by this call expires after {@code ttl}.
     */
    long incrementAndGet(String key, Duration ttl);
}
