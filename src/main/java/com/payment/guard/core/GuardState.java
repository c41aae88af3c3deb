package com.payment.guard.core;

/**
 * Stages an attempt moves through. APPROVED, CHALLENGED and REJECTED are terminal.
 */
public enum GuardState {
    RECEIVED,
    RATE_CHECKED,
    VALIDATED,
    SCORED,
    APPROVED,
    CHALLENGED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == CHALLENGED || this == REJECTED;
    }
}
