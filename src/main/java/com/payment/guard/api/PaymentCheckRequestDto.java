package com.payment.guard.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Request body for checking a mobile-money payment before execution.
 * Only the user id is checked here since it keys the rate limiter; amount, currency, provider, country
 * and phone are judged by the guard's validator so every field error is reported together.
 */
@Data
public class PaymentCheckRequestDto {

    /** Optional caller-assigned id; generated when absent. */
    private String attemptId;

    @NotBlank(message = "userId is required")
    private String userId;

    private BigDecimal amount;

    private String currency;

    private String providerId;

    private String countryCode;

    private String phoneNumber;
}
