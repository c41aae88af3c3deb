package com.payment.guard.ratelimit;

import lombok.Value;

/**
 * At most {@code limit} requests per fixed window of {@code windowSeconds}.
 */
@Value
public class RateLimitRule {

    int limit;
    long windowSeconds;

    public RateLimitRule(int limit, long windowSeconds) {
        if (limit < 1 || windowSeconds < 1) {
            throw new IllegalArgumentException("limit and windowSeconds must be positive: " + limit + "/" + windowSeconds);
        }
        this.limit = limit;
        this.windowSeconds = windowSeconds;
    }

    public long windowStartFor(long epochSecond) {
        return Math.floorDiv(epochSecond, windowSeconds) * windowSeconds;
    }
}
