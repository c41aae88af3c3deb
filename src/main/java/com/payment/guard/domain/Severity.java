package com.payment.guard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a security event. Drives the base of its risk contribution.
 */
public enum Severity {
    LOW(10),
    MEDIUM(30),
    HIGH(70),
    CRITICAL(90);

    private final int baseScore;

    Severity(int baseScore) {
        this.baseScore = baseScore;
    }

    public int getBaseScore() {
        return baseScore;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
