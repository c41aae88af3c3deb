package com.payment.guard.webhook;

import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.WebhookEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authenticates inbound provider webhooks: both headers present, timestamp inside the replay window,
 * and an HMAC-SHA256 of {@code timestamp.body} under the source's secret, compared in constant time.
 * <p>
 * Every refusal writes exactly one security event; an accepted delivery writes none.
 * Any internal error is a refusal too.
 */
@Slf4j
@Service
public class SignatureVerifier {

    private final SecurityEventSink eventSink;
    private final Clock clock;
    private final Map<String, String> secrets;
    private final long replayToleranceSeconds;

    public SignatureVerifier(SecurityEventSink eventSink, Clock clock, GuardProperties properties) {
        this.eventSink = eventSink;
        this.clock = clock;
        this.secrets = Map.copyOf(properties.getWebhook().getSecrets());
        this.replayToleranceSeconds = properties.getWebhook().getReplayToleranceSeconds();
        secrets.forEach((source, secret) -> {
            if (secret == null || secret.isBlank()) {
                log.warn("Webhook secret for source={} is blank; its deliveries will be rejected", source);
            } else if (secret.length() < 32) {
                log.warn("Webhook secret for source={} is shorter than 32 characters", source);
            }
        });
        log.info("SignatureVerifier initialized for sources={} replayTolerance={}s", secrets.keySet(), replayToleranceSeconds);
    }

    public VerificationResult verify(WebhookEnvelope envelope, String sourceTag) {
        Instant now = clock.instant();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", sourceTag);
        VerificationResult result;
        try {
            result = evaluate(envelope, sourceTag, now, details);
        } catch (Exception e) {
            log.error("Webhook verification error for source={}", sourceTag, e);
            details.put("error", e.getClass().getSimpleName());
            result = VerificationResult.rejected(VerificationFailure.VERIFICATION_ERROR, null);
        }

        if (!result.isValid()) {
            VerificationFailure failure = result.getFailure();
            log.warn("Webhook rejected: source={} reason={} ip={}", sourceTag, failure.getReason(), envelope.getSourceIp());
            eventSink.append(SecurityEvent.of(failure.getEventType(), failure.getSeverity(), null,
                    envelope.getSourceIp(), envelope.getUserAgent(), details, now));
        }
        return result;
    }

    private VerificationResult evaluate(WebhookEnvelope envelope, String sourceTag, Instant now, Map<String, Object> details) {
        String signature = envelope.getSignatureHeader();
        String timestampHeader = envelope.getTimestampHeader();

        if (signature == null || signature.isBlank()) {
            details.put("error", "Missing signature header");
            return VerificationResult.rejected(VerificationFailure.MISSING_SIGNATURE, null);
        }
        if (timestampHeader == null || timestampHeader.isBlank()) {
            details.put("error", "Missing timestamp header");
            return VerificationResult.rejected(VerificationFailure.MISSING_TIMESTAMP, null);
        }

        String timestampText = timestampHeader.trim();
        long timestamp;
        try {
            timestamp = Long.parseLong(timestampText);
        } catch (NumberFormatException e) {
            details.put("error", "Timestamp header is not Unix seconds");
            return VerificationResult.rejected(VerificationFailure.MALFORMED_TIMESTAMP, null);
        }

        long currentTimestamp = now.getEpochSecond();
        long timeDifference = Math.abs(currentTimestamp - timestamp);
        if (timeDifference > replayToleranceSeconds) {
            details.put("timeDifference", timeDifference);
            details.put("webhookTimestamp", timestamp);
            details.put("currentTimestamp", currentTimestamp);
            return VerificationResult.rejected(VerificationFailure.WEBHOOK_REPLAY, timestamp);
        }

        String secret = sourceTag != null ? secrets.get(sourceTag) : null;
        if (secret == null || secret.isBlank()) {
            details.put("error", "No secret configured for source");
            return VerificationResult.rejected(VerificationFailure.UNKNOWN_SOURCE, timestamp);
        }

        byte[] expected = WebhookSignatures.hmac(secret, timestampText, envelope.getRawBody() != null ? envelope.getRawBody() : "");
        byte[] provided = WebhookSignatures.decodeHeader(signature);
        if (provided == null || !MessageDigest.isEqual(expected, provided)) {
            details.put("signatureFormatValid", provided != null);
            return VerificationResult.rejected(VerificationFailure.INVALID_SIGNATURE, timestamp);
        }
        return VerificationResult.accepted(timestamp);
    }
}
