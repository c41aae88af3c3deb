package com.payment.guard.ratelimit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one check-and-increment.
 */
@Value
@Builder
public class RateLimitDecision {

    boolean allowed;
    int remaining;
    /** Start of the next window. */
    Instant resetAt;
    int limit;
    long count;
    /** False when the counter store failed and the limiter denied by default. */
    boolean storeAvailable;

    public long retryAfterSeconds(Instant now) {
        return Math.max(0, resetAt.getEpochSecond() - now.getEpochSecond());
    }
}
