package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single mobile-money payment attempt as submitted by the storefront. Produced by the caller,
 * read-only inside the pipeline. The header fields feed device/automation signals only.
 */
@Value
@Builder(toBuilder = true)
public class PaymentAttempt {

    /** Identifier assigned at ingestion; history records and audit events reference it. */
    String attemptId;
    String userId;
    BigDecimal amount;
    /** ISO 4217 currency code. */
    String currency;
    /** Mobile-money provider id, e.g. MTN_MOMO or MPESA. */
    String providerId;
    /** ISO 3166 alpha-2 country of the wallet. */
    String countryCode;
    String phoneNumber;
    String sourceIp;
    String userAgent;
    /** Raw Accept header, null when absent. */
    String accept;
    /** Raw Accept-Encoding header, null when absent. */
    String acceptEncoding;
    Instant timestamp;
}
