package com.payment.guard.api;

import com.payment.guard.domain.AttemptStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Execution result of a checked attempt, reported by the payment executor.
 */
@Data
public class OutcomeRequestDto {

    /** COMPLETED or FAILED. */
    @NotNull(message = "status is required")
    private AttemptStatus status;
}
