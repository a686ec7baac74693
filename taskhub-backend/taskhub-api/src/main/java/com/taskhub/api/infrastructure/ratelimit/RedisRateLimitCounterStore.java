package com.taskhub.api.infrastructure.ratelimit;

import com.taskhub.api.domain.ratelimit.RateLimitCounterStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Counter store shared by every API instance. INCR and PEXPIRE run in one Lua script,
 * so concurrent requests never interleave between reading and writing a counter.
 */
@Component
@ConditionalOnProperty(prefix = "taskhub.rate-limit", name = "store", havingValue = "redis")
public class RedisRateLimitCounterStore implements RateLimitCounterStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> fixedWindowScript;

    public RedisRateLimitCounterStore(StringRedisTemplate redisTemplate, RedisScript<Long> fixedWindowScript) {
        this.redisTemplate = redisTemplate;
        this.fixedWindowScript = fixedWindowScript;
    }

    @Override
    public long incrementAndGet(String key, Duration ttl) {
        Long count = redisTemplate.execute(
                fixedWindowScript,
                List.of(key),
                String.valueOf(Math.max(1, ttl.toMillis()))
        );
        if (count == null) {
            throw new IllegalStateException("Rate limit script returned no value for key " + key);
        }
        return count;
    }
}
