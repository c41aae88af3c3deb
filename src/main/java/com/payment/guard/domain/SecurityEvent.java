package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit record written whenever a component makes a security-relevant decision.
 * The details map is diagnostic payload only; nothing in the pipeline branches on it.
 */
@Value
@Builder
public class SecurityEvent {

    String eventId;
    SecurityEventType eventType;
    Severity severity;
    /** Null for anonymous callers such as webhook deliveries. */
    String userId;
    String ip;
    String userAgent;
    Map<String, Object> details;
    int riskScoreContribution;
    Instant occurredAt;

    public static SecurityEvent of(SecurityEventType type, Severity severity, String userId, String ip,
                                   String userAgent, Map<String, Object> details, Instant occurredAt) {
        return SecurityEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .severity(severity)
                .userId(userId)
                .ip(ip)
                .userAgent(userAgent)
                .details(details != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                        : Collections.emptyMap())
                .riskScoreContribution(type.contributionFor(severity))
                .occurredAt(occurredAt)
                .build();
    }
}
