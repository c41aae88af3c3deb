package com.payment.guard.core;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable reason attached to every non-approved decision, with the HTTP status it maps to
 * and the message shown to the caller.
 */
public enum ReasonCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Payment validation failed"),
    DAILY_LIMIT_EXCEEDED(HttpStatus.BAD_REQUEST, "Daily transaction limit exceeded"),
    SECURITY_BLOCK(HttpStatus.FORBIDDEN, "Transaction blocked for security reasons"),
    MANUAL_REVIEW_REQUIRED(HttpStatus.ACCEPTED, "Transaction requires additional verification"),
    PAYMENT_RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS, "Too many payment attempts, please try again later"),
    RATE_LIMITER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    WEBHOOK_AUTH_FAILED(HttpStatus.UNAUTHORIZED, "Webhook authentication failed"),
    WEBHOOK_RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS, "Too many webhook deliveries"),
    VERIFICATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Webhook verification error");

    private final HttpStatus httpStatus;
    private final String message;

    ReasonCode(HttpStatus httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getMessage() {
        return message;
    }
}
