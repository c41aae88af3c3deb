package com.payment.guard.persistence.entity;

import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.Recommendation;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A scored payment attempt and its latest status. Scoring reads these back as history.
 */
@Entity
@Table(name = "payment_attempts", indexes = {
    @Index(name = "idx_attempt_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_attempt_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAttemptEntity {

    @Id
    @Column(name = "attempt_id", nullable = false)
    private String attemptId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "amount", precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "provider_id", length = 50)
    private String providerId;

    @Column(name = "country_code", length = 2)
    private String countryCode;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(name = "source_ip", length = 64)
    private String sourceIp;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AttemptStatus status;

    @Column(name = "risk_score")
    private Integer riskScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "recommendation", length = 10)
    private Recommendation recommendation;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
