package com.payment.guard.ratelimit;

/**
 * Groups of endpoints sharing one rate-limit budget, with their built-in (limit, window) pairs.
 */
public enum EndpointClass {
    AUTH(5, 300),
    PAYMENT(10, 600),
    WEBHOOK(1000, 3600),
    WITHDRAWAL(3, 3600),
    GENERAL(100, 3600);

    private final int defaultLimit;
    private final long defaultWindowSeconds;

    EndpointClass(int defaultLimit, long defaultWindowSeconds) {
        this.defaultLimit = defaultLimit;
        this.defaultWindowSeconds = defaultWindowSeconds;
    }

    public RateLimitRule defaultRule() {
        return new RateLimitRule(defaultLimit, defaultWindowSeconds);
    }
}
