package com.payment.guard.webhook;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of verifying one webhook delivery.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VerificationResult {

    boolean valid;
    VerificationFailure failure;
    /** Parsed delivery timestamp (Unix seconds), null when it could not be read. */
    Long timestamp;

    public static VerificationResult accepted(long timestamp) {
        return new VerificationResult(true, null, timestamp);
    }

    public static VerificationResult rejected(VerificationFailure failure, Long timestamp) {
        return new VerificationResult(false, failure, timestamp);
    }

    /** Machine-readable reason, null when valid. */
    public String getReason() {
        return failure != null ? failure.getReason() : null;
    }
}
