package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A prior payment attempt plus its outcome, as read back from the event sink. This is the unit of
 * history every velocity, failure, amount and duplicate factor is computed from.
 */
@Value
@Builder(toBuilder = true)
public class AttemptRecord {

    String attemptId;
    String userId;
    BigDecimal amount;
    String currency;
    String providerId;
    String countryCode;
    String phoneNumber;
    String sourceIp;
    Instant createdAt;
    AttemptStatus status;
    Integer riskScore;
    Recommendation recommendation;

    public boolean isFailed() {
        return status == AttemptStatus.FAILED;
    }

    public boolean isCompleted() {
        return status == AttemptStatus.COMPLETED;
    }

    public static AttemptRecord of(PaymentAttempt attempt, RiskAssessment assessment, AttemptStatus status) {
        return AttemptRecord.builder()
                .attemptId(attempt.getAttemptId())
                .userId(attempt.getUserId())
                .amount(attempt.getAmount())
                .currency(attempt.getCurrency())
                .providerId(attempt.getProviderId())
                .countryCode(attempt.getCountryCode())
                .phoneNumber(attempt.getPhoneNumber())
                .sourceIp(attempt.getSourceIp())
                .createdAt(attempt.getTimestamp())
                .status(status)
                .riskScore(assessment != null ? assessment.getScore() : null)
                .recommendation(assessment != null ? assessment.getRecommendation() : null)
                .build();
    }
}
