package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * The slice of a storefront account the pipeline needs: role and creation time.
 */
@Value
@Builder
public class UserAccount {

    String userId;
    AccountRole role;
    Instant createdAt;

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }
}
