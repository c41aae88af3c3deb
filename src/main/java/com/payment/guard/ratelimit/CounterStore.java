package com.payment.guard.ratelimit;

/**
 * Storage for rate-limit counters. Implementations must make the increment atomic per key:
 * concurrent callers on the same (identifier, class, window) are linearized, different keys are not
 * coordinated at all.
 */
public interface CounterStore {

    /**
     * Increments the counter for the window starting at {@code windowStart} (epoch seconds) and
     * returns the new count. A counter from an earlier window is discarded. Counting stops at
     * {@code rule.limit + 1}, so rejected requests keep the window closed without inflating it.
     *
     * @throws com.payment.guard.audit.SecurityStoreException when the store cannot be reached
     */
    long incrementAndGet(String identifier, EndpointClass endpointClass, long windowStart, RateLimitRule rule);
}
