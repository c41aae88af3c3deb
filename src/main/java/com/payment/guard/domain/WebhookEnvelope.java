package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

/**
 * An inbound provider webhook, held only for the duration of verification. Never persisted as-is.
 */
@Value
@Builder
public class WebhookEnvelope {

    /** Exact bytes of the request body as a UTF-8 string; signatures are computed over it. */
    String rawBody;
    /** Hex HMAC, optionally prefixed with {@code sha256=}. */
    String signatureHeader;
    /** Unix seconds. */
    String timestampHeader;
    /** Upstream provider the delivery claims to come from, e.g. yellowcard. */
    String sourceTag;
    String sourceIp;
    String userAgent;
}
