package com.payment.guard.webhook;

import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;

/**
 * Why a webhook delivery was refused, with the event each reason is recorded as.
 */
public enum VerificationFailure {
    MISSING_SIGNATURE("missing_signature", SecurityEventType.MISSING_SIGNATURE, Severity.MEDIUM),
    MISSING_TIMESTAMP("missing_timestamp", SecurityEventType.MISSING_TIMESTAMP, Severity.MEDIUM),
    MALFORMED_TIMESTAMP("malformed_timestamp", SecurityEventType.MALFORMED_TIMESTAMP, Severity.MEDIUM),
    WEBHOOK_REPLAY("webhook_replay", SecurityEventType.WEBHOOK_REPLAY, Severity.HIGH),
    UNKNOWN_SOURCE("unknown_source", SecurityEventType.UNKNOWN_WEBHOOK_SOURCE, Severity.HIGH),
    INVALID_SIGNATURE("invalid_signature", SecurityEventType.INVALID_SIGNATURE, Severity.HIGH),
    VERIFICATION_ERROR("verification_error", SecurityEventType.WEBHOOK_VERIFICATION_ERROR, Severity.HIGH);

    private final String reason;
    private final SecurityEventType eventType;
    private final Severity severity;

    VerificationFailure(String reason, SecurityEventType eventType, Severity severity) {
        this.reason = reason;
        this.eventType = eventType;
        this.severity = severity;
    }

    public String getReason() {
        return reason;
    }

    public SecurityEventType getEventType() {
        return eventType;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Our own failure rather than the sender's; answered with 500, still denied. */
    public boolean isInternal() {
        return this == VERIFICATION_ERROR;
    }
}
