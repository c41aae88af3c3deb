package com.payment.guard.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis wiring for the shared rate-limit counter store.
 */
@Configuration
@ConditionalOnProperty(name = "guard.rate-limit.store", havingValue = "redis")
public class RedisConfig {

    /**
     * Increment-and-read in one round trip. KEYS[1] counter key, ARGV[1] limit, ARGV[2] window seconds.
     * Stops incrementing once past the limit; the first increment sets the expiry.
     */
    static final String INCREMENT_SCRIPT =
            "local c = redis.call('GET', KEYS[1]) "
                    + "if c and tonumber(c) > tonumber(ARGV[1]) then return tonumber(c) end "
                    + "c = redis.call('INCR', KEYS[1]) "
                    + "if c == 1 then redis.call('EXPIRE', KEYS[1], ARGV[2]) end "
                    + "return c";

    @Bean
    public RedisScript<Long> rateLimitIncrementScript() {
        return new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);
    }
}
