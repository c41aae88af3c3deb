package com.payment.guard.domain;

/**
 * Lifecycle of a recorded payment attempt. PENDING/UNDER_REVIEW/BLOCKED are written by the guard;
 * COMPLETED/FAILED are reported back by the caller once the provider has answered.
 */
public enum AttemptStatus {
    PENDING,
    UNDER_REVIEW,
    BLOCKED,
    COMPLETED,
    FAILED
}
