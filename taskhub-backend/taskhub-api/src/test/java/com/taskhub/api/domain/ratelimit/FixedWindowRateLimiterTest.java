package com.taskhub.api.domain.ratelimit;

import com.taskhub.api.infrastructure.ratelimit.InMemoryRateLimitCounterStore;
import com.taskhub.api.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FixedWindowRateLimiter")
class FixedWindowRateLimiterTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    // 10 seconds into a 60 second window
    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(6_000_010));
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new FixedWindowRateLimiter(new InMemoryRateLimitCounterStore(clock), clock);
    }

    @Test
    @DisplayName("admits exactly limit requests per window and counts remaining down to zero")
    void admitsUpToLimit() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision decision = limiter.checkAndIncrement("auth:ip:10.0.0.1", 5, WINDOW);
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.remaining()).isEqualTo(5 - i);
        }

        RateLimitDecision rejected = limiter.checkAndIncrement("auth:ip:10.0.0.1", 5, WINDOW);

        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.limit()).isEqualTo(5);
    }

    @Test
    @DisplayName("retry-after is the time left in the current window, rounded up")
    void retryAfterUntilWindowEnd() {
        clock.advance(Duration.ofMillis(500));
        limiter.checkAndIncrement("k", 1, WINDOW);

        RateLimitDecision rejected = limiter.checkAndIncrement("k", 1, WINDOW);

        // 10.5s elapsed -> 49.5s left
        assertThat(rejected.retryAfterSeconds()).isEqualTo(50);
    }

    @Test
    @DisplayName("retry-after is at least one second at the very end of a window")
    void retryAfterAtLeastOneSecond() {
        clock.advance(Duration.ofMillis(49_999));
        limiter.checkAndIncrement("k", 1, WINDOW);

        assertThat(limiter.checkAndIncrement("k", 1, WINDOW).retryAfterSeconds()).isEqualTo(1);
    }

    @Test
    @DisplayName("a new window starts from zero")
    void newWindowResets() {
        limiter.checkAndIncrement("k", 1, WINDOW);
        assertThat(limiter.checkAndIncrement("k", 1, WINDOW).allowed()).isFalse();

        clock.advance(Duration.ofSeconds(50));

        assertThat(limiter.checkAndIncrement("k", 1, WINDOW).allowed()).isTrue();
    }

    @Test
    @DisplayName("keys are counted independently")
    void keysAreIndependent() {
        limiter.checkAndIncrement("api:user:1", 1, WINDOW);

        assertThat(limiter.checkAndIncrement("api:user:1", 1, WINDOW).allowed()).isFalse();
        assertThat(limiter.checkAndIncrement("api:user:2", 1, WINDOW).allowed()).isTrue();
    }

    @Test
    @DisplayName("concurrent requests never admit more than the limit")
    void concurrentRequestsRespectLimit() throws Exception {
        int threads = 16;
        int attemptsPerThread = 25;
        int limit = 60;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Callable<Integer> worker = () -> {
                    start.await();
                    int admitted = 0;
                    for (int i = 0; i < attemptsPerThread; i++) {
                        if (limiter.checkAndIncrement("api:user:7", limit, WINDOW).allowed()) {
                            admitted++;
                        }
                    }
                    return admitted;
                };
                futures.add(pool.submit(worker));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> future : futures) {
                total += future.get(10, TimeUnit.SECONDS);
            }
            assertThat(total).isEqualTo(limit);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("rejects a non-positive window")
    void rejectsZeroWindow() {
        assertThatThrownBy(() -> limiter.checkAndIncrement("k", 1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
