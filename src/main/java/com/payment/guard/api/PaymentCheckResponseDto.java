package com.payment.guard.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.payment.guard.core.GuardDecision;
import com.payment.guard.core.GuardState;
import com.payment.guard.core.ReasonCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Result of a payment check. Risk factors are never included; a rejected or challenged attempt carries
 * only the opaque score.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentCheckResponseDto {

    String attemptId;
    GuardState status;
    ReasonCode reasonCode;
    String message;
    Integer riskScore;
    Map<String, String> errors;
    BigDecimal fee;
    BigDecimal total;
    String formattedPhone;
    String estimatedReviewTime;
    Long retryAfterSeconds;

    public static PaymentCheckResponseDto from(GuardDecision decision) {
        return PaymentCheckResponseDto.builder()
                .attemptId(decision.getAttemptId())
                .status(decision.getState())
                .reasonCode(decision.getReasonCode())
                .message(decision.getReasonCode() != null ? decision.getReasonCode().getMessage() : "Payment approved")
                .riskScore(decision.getRiskScore())
                .errors(decision.getValidationErrors())
                .fee(decision.getFee())
                .total(decision.getTotal())
                .formattedPhone(decision.getFormattedPhone())
                .estimatedReviewTime(decision.getEstimatedReviewTime())
                .retryAfterSeconds(decision.getRetryAfterSeconds())
                .build();
    }
}
