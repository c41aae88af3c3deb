package com.payment.guard.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Manual-review queue entry for a challenged attempt.
 */
@Entity
@Table(name = "manual_review_queue", indexes = {
    @Index(name = "idx_review_status_created", columnList = "status, created_at"),
    @Index(name = "idx_review_attempt_id", columnList = "attempt_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReviewEntity {

    @Id
    @Column(name = "ticket_id", nullable = false)
    private String ticketId;

    @Column(name = "attempt_id", nullable = false)
    private String attemptId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "amount", precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "provider_id", length = 50)
    private String providerId;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "manual_review_factors", joinColumns = @JoinColumn(name = "ticket_id"))
    @Column(name = "factor", nullable = false)
    @Builder.Default
    private Set<String> riskFactors = new LinkedHashSet<>();

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
