package com.payment.guard.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process counter store. {@link ConcurrentHashMap#compute} serializes updates per key,
 * which is exactly the linearization the limiter needs.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "guard.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCounterStore implements CounterStore {

    private final Map<Key, Entry> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long incrementAndGet(String identifier, EndpointClass endpointClass, long windowStart, RateLimitRule rule) {
        Key key = new Key(identifier, endpointClass);
        Entry updated = counters.compute(key, (k, current) -> {
            if (current == null || current.counter.getWindowStart() != windowStart) {
                return new Entry(new RateLimitCounter(identifier, endpointClass, windowStart, 1), windowStart + rule.getWindowSeconds());
            }
            if (current.counter.getCount() > rule.getLimit()) {
                return current;
            }
            return new Entry(current.counter.increment(), current.expiresAt);
        });
        return updated.counter.getCount();
    }

    /** Drops counters whose window has closed. */
    @Scheduled(fixedDelayString = "${guard.rate-limit.eviction-interval-ms:60000}")
    public void evictExpired() {
        long now = clock.instant().getEpochSecond();
        int before = counters.size();
        counters.entrySet().removeIf(e -> e.getValue().expiresAt <= now);
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate-limit counters", evicted);
        }
    }

    int size() {
        return counters.size();
    }

    private static final class Key {
        private final String identifier;
        private final EndpointClass endpointClass;

        private Key(String identifier, EndpointClass endpointClass) {
            this.identifier = identifier;
            this.endpointClass = endpointClass;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return Objects.equals(identifier, other.identifier) && endpointClass == other.endpointClass;
        }

        @Override
        public int hashCode() {
            return Objects.hash(identifier, endpointClass);
        }
    }

    private static final class Entry {
        private final RateLimitCounter counter;
        private final long expiresAt;

        private Entry(RateLimitCounter counter, long expiresAt) {
            this.counter = counter;
            this.expiresAt = expiresAt;
        }
    }
}
