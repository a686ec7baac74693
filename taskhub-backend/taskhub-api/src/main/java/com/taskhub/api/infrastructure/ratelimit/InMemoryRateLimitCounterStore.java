package com.taskhub.api.infrastructure.ratelimit;

import com.taskhub.api.domain.ratelimit.RateLimitCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-instance counter store. Counters are shared by all request threads of this JVM only.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "taskhub.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long incrementAndGet(String key, Duration ttl) {
        long expiresAt = clock.millis() + ttl.toMillis();
        return counters.computeIfAbsent(key, k -> new Counter(expiresAt)).value.incrementAndGet();
    }

    @Scheduled(fixedDelayString = "PT1M")
    public void evictExpired() {
        long now = clock.millis();
        int before = counters.size();
        counters.values().removeIf(counter -> counter.expiresAt <= now);
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("[RATE_LIMIT_EVICT] Expired counters removed | evicted={} | remaining={}", evicted, counters.size());
        }
    }

    int size() {
        return counters.size();
    }

    private static final class Counter {
        private final AtomicLong value = new AtomicLong();
        private final long expiresAt;

        private Counter(long expiresAt) {
            this.expiresAt = expiresAt;
        }
    }
}
