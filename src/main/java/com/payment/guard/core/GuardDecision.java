package com.payment.guard.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Terminal outcome of one guarded payment attempt or webhook delivery.
 * <p>
 * {@code riskFactors} is for audit only and must not reach end users.
 */
@Value
@Builder
public class GuardDecision {

    public static final String ESTIMATED_REVIEW_TIME = "1-24 hours";

    GuardState state;
    /** Null when approved. */
    ReasonCode reasonCode;
    /** Short tag for the cause: rate_limited, validation_failed, webhook_replay, ... */
    String reason;
    String attemptId;
    Integer riskScore;
    Set<String> riskFactors;
    Map<String, String> validationErrors;
    Long retryAfterSeconds;
    Integer rateLimitRemaining;
    Instant rateLimitResetAt;
    BigDecimal fee;
    BigDecimal total;
    String formattedPhone;
    String estimatedReviewTime;
    @Singular("trailStep")
    List<GuardState> trail;

    public HttpStatus getHttpStatus() {
        return reasonCode != null ? reasonCode.getHttpStatus() : HttpStatus.OK;
    }

    public boolean isApproved() {
        return state == GuardState.APPROVED;
    }
}
