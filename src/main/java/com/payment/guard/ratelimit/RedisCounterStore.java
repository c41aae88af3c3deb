package com.payment.guard.ratelimit;

import com.payment.guard.audit.SecurityStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Counter store shared by every instance of the service. The capped increment runs as one Lua
 * script, so Redis executes it atomically; the key carries the window start and expires with it.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "guard.rate-limit.store", havingValue = "redis")
public class RedisCounterStore implements CounterStore {

    static final String KEY_PREFIX = "guard:ratelimit:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementScript;

    public RedisCounterStore(StringRedisTemplate redisTemplate, RedisScript<Long> rateLimitIncrementScript) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = rateLimitIncrementScript;
    }

    @Override
    public long incrementAndGet(String identifier, EndpointClass endpointClass, long windowStart, RateLimitRule rule) {
        String key = keyFor(identifier, endpointClass, windowStart);
        Long count;
        try {
            count = redisTemplate.execute(incrementScript, List.of(key),
                    String.valueOf(rule.getLimit()), String.valueOf(rule.getWindowSeconds()));
        } catch (Exception e) {
            throw new SecurityStoreException("Rate-limit counter increment failed for key " + key, e);
        }
        if (count == null) {
            throw new SecurityStoreException("Rate-limit script returned no count for key " + key);
        }
        return count;
    }

    static String keyFor(String identifier, EndpointClass endpointClass, long windowStart) {
        return KEY_PREFIX + endpointClass.name().toLowerCase() + ":" + identifier + ":" + windowStart;
    }
}
