package com.payment.guard.ratelimit;

import lombok.Value;

/**
 * Live counter for one (identifier, endpoint class) key. Replaced, not merged, when a new window starts.
 */
@Value
public class RateLimitCounter {

    String identifier;
    EndpointClass endpointClass;
    long windowStart;
    long count;

    RateLimitCounter increment() {
        return new RateLimitCounter(identifier, endpointClass, windowStart, count + 1);
    }
}
