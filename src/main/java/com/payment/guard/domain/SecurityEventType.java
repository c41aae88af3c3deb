package com.payment.guard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every kind of security event the pipeline writes. The multiplier scales the severity's base score
 * into the event's risk contribution.
 */
public enum SecurityEventType {
    MISSING_SIGNATURE("missing_signature", 1.5),
    MISSING_TIMESTAMP("missing_timestamp", 1.5),
    MALFORMED_TIMESTAMP("malformed_timestamp", 1.5),
    INVALID_SIGNATURE("invalid_signature", 1.5),
    UNKNOWN_WEBHOOK_SOURCE("unknown_webhook_source", 1.5),
    WEBHOOK_REPLAY("webhook_replay", 1.3),
    WEBHOOK_VERIFICATION_ERROR("webhook_verification_error", 1.0),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", 1.1),
    RATE_LIMITER_UNAVAILABLE("rate_limiter_unavailable", 1.0),
    DUPLICATE_PAYMENT("duplicate_payment", 1.2),
    PAYMENT_DECISION("payment_decision", 1.0),
    HIGH_RISK_TRANSACTION("high_risk_transaction", 1.4),
    UNUSUAL_TIMING_PATTERN("unusual_timing_pattern", 1.0),
    UNUSUAL_AMOUNT_PATTERN("unusual_amount_pattern", 1.0);

    private final String code;
    private final double multiplier;

    SecurityEventType(String code, double multiplier) {
        this.code = code;
        this.multiplier = multiplier;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public int contributionFor(Severity severity) {
        return (int) Math.min(Math.round(severity.getBaseScore() * multiplier), 100);
    }

    public static SecurityEventType fromCode(String code) {
        for (SecurityEventType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown security event type: " + code);
    }
}
