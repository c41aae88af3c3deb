package com.payment.guard.persistence.entity;

import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only security event row. Details are stored as JSON text.
 */
@Entity
@Table(name = "security_events", indexes = {
    @Index(name = "idx_security_event_user_id", columnList = "user_id"),
    @Index(name = "idx_security_event_type", columnList = "event_type"),
    @Index(name = "idx_security_event_occurred_at", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityEventEntity {

    @Id
    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50)
    private SecurityEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private Severity severity;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "ip", length = 64)
    private String ip;

    @Column(name = "user_agent", length = 1000)
    private String userAgent;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "risk_score_contribution", nullable = false)
    private int riskScoreContribution;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;
}
