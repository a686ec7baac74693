package com.taskhub.api.domain.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

import static com.taskhub.api.domain.constants.AuthConstants.RATE_LIMIT_KEY_PREFIX;

/**
 * Fixed-window counter: time is cut into non-overlapping windows of equal length and each key may
 * make at most {@code limit} requests per window. The counter for a window lives under its own
 * store key, so a new window starts from zero without any reset step.
 */
@Component
@Slf4j
public class FixedWindowRateLimiter {

    private final RateLimitCounterStore counterStore;
    private final Clock clock;

    public FixedWindowRateLimiter(RateLimitCounterStore counterStore, Clock clock) {
        this.counterStore = counterStore;
        this.clock = clock;
    }

    public RateLimitDecision checkAndIncrement(String key, int limit, Duration window) {
        long windowMillis = window.toMillis();
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("Rate limit window must be positive: " + window);
        }

        long now = clock.millis();
        long windowStart = now - Math.floorMod(now, windowMillis);
        long millisLeft = windowStart + windowMillis - now;

        String counterKey = RATE_LIMIT_KEY_PREFIX + key + ":" + windowStart;
        long count = counterStore.incrementAndGet(counterKey, Duration.ofMillis(millisLeft));

        if (count > limit) {
            long retryAfter = Math.max(1, (millisLeft + 999) / 1000);
            log.debug("[RATE_LIMIT_REJECTED] Window budget exhausted | key={} | count={} | limit={} | retryAfter={}s",
                    key, count, limit, retryAfter);
            return RateLimitDecision.rejected(limit, retryAfter);
        }
        return RateLimitDecision.allowed(limit, limit - count);
    }
}
