package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Entry in the manual-review queue for a CHALLENGED attempt.
 */
@Value
@Builder
public class ReviewTicket {

    public static final String STATUS_PENDING = "PENDING";

    String ticketId;
    String attemptId;
    String userId;
    BigDecimal amount;
    String currency;
    String providerId;
    int riskScore;
    Set<String> riskFactors;
    String status;
    Instant createdAt;
}
