package com.taskhub.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis wiring for the distributed rate-limit counter store.
 * Boot's auto-configured StringRedisTemplate already uses String serializers for keys and values,
 * so only the Lua script needs declaring.
 */
@Configuration
@ConditionalOnProperty(prefix = "taskhub.rate-limit", name = "store", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisScript<Long> fixedWindowScript() {
        return RedisScript.of(
                new ClassPathResource("scripts/fixed_window.lua"),
                Long.class
        );
    }
}
