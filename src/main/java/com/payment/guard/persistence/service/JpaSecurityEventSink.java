package com.payment.guard.persistence.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.guard.audit.SecurityEventPublisher;
import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.audit.SecurityStoreException;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.ReviewTicket;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.persistence.entity.ManualReviewEntity;
import com.payment.guard.persistence.entity.PaymentAttemptEntity;
import com.payment.guard.persistence.entity.SecurityEventEntity;
import com.payment.guard.persistence.repository.ManualReviewRepository;
import com.payment.guard.persistence.repository.PaymentAttemptRepository;
import com.payment.guard.persistence.repository.SecurityEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed event sink. Every appended event is also handed to the Kafka publisher when one
 * is configured. Writes log and swallow failures; history reads wrap them in
 * {@link SecurityStoreException}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "guard.sink.type", havingValue = "jpa", matchIfMissing = true)
public class JpaSecurityEventSink implements SecurityEventSink {

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final SecurityEventRepository eventRepository;
    private final PaymentAttemptRepository attemptRepository;
    private final ManualReviewRepository reviewRepository;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<SecurityEventPublisher> publisher;
    private final Clock clock;

    public JpaSecurityEventSink(SecurityEventRepository eventRepository,
                                PaymentAttemptRepository attemptRepository,
                                ManualReviewRepository reviewRepository,
                                ObjectMapper objectMapper,
                                ObjectProvider<SecurityEventPublisher> publisher,
                                Clock clock) {
        this.eventRepository = eventRepository;
        this.attemptRepository = attemptRepository;
        this.reviewRepository = reviewRepository;
        this.objectMapper = objectMapper;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void append(SecurityEvent event) {
        try {
            SecurityEventEntity entity = SecurityEventEntity.builder()
                    .eventId(event.getEventId())
                    .eventType(event.getEventType())
                    .severity(event.getSeverity())
                    .userId(event.getUserId())
                    .ip(event.getIp())
                    .userAgent(truncate(event.getUserAgent(), 1000))
                    .details(objectMapper.writeValueAsString(event.getDetails()))
                    .riskScoreContribution(event.getRiskScoreContribution())
                    .occurredAt(event.getOccurredAt())
                    .build();
            eventRepository.save(entity);
            log.debug("Persisted security event: eventId={}, type={}, severity={}",
                    event.getEventId(), event.getEventType().getCode(), event.getSeverity().code());
        } catch (Exception e) {
            log.error("Failed to persist security event: eventId={} type={}", event.getEventId(),
                    event.getEventType().getCode(), e);
            // Don't throw - the decision already stands
        }
        publisher.ifAvailable(p -> p.publish(event));
    }

    @Override
    public void recordAttempt(AttemptRecord attempt) {
        try {
            attemptRepository.save(PaymentAttemptEntity.builder()
                    .attemptId(attempt.getAttemptId())
                    .userId(attempt.getUserId())
                    .amount(attempt.getAmount())
                    .currency(attempt.getCurrency())
                    .providerId(attempt.getProviderId())
                    .countryCode(attempt.getCountryCode())
                    .phoneNumber(attempt.getPhoneNumber())
                    .sourceIp(attempt.getSourceIp())
                    .status(attempt.getStatus())
                    .riskScore(attempt.getRiskScore())
                    .recommendation(attempt.getRecommendation())
                    .createdAt(attempt.getCreatedAt())
                    .updatedAt(attempt.getCreatedAt())
                    .build());
        } catch (Exception e) {
            log.error("Failed to persist payment attempt: attemptId={}", attempt.getAttemptId(), e);
        }
    }

    @Override
    public boolean updateAttemptStatus(String attemptId, AttemptStatus status) {
        try {
            return attemptRepository.updateStatus(attemptId, status, clock.instant()) > 0;
        } catch (Exception e) {
            log.error("Failed to update attempt status: attemptId={} status={}", attemptId, status, e);
            return false;
        }
    }

    @Override
    public List<AttemptRecord> queryRecent(String userId, long withinSeconds) {
        Instant since = clock.instant().minusSeconds(withinSeconds);
        try {
            return attemptRepository.findRecentByUser(userId, since).stream()
                    .map(JpaSecurityEventSink::toRecord)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            throw new SecurityStoreException("Failed to read attempt history for user " + userId, e);
        }
    }

    @Override
    public void enqueueForReview(ReviewTicket ticket) {
        try {
            reviewRepository.save(ManualReviewEntity.builder()
                    .ticketId(ticket.getTicketId())
                    .attemptId(ticket.getAttemptId())
                    .userId(ticket.getUserId())
                    .amount(ticket.getAmount())
                    .currency(ticket.getCurrency())
                    .providerId(ticket.getProviderId())
                    .riskScore(ticket.getRiskScore())
                    .riskFactors(new LinkedHashSet<>(ticket.getRiskFactors()))
                    .status(ticket.getStatus())
                    .createdAt(ticket.getCreatedAt())
                    .build());
            log.info("Attempt queued for manual review: ticketId={} attemptId={} riskScore={}",
                    ticket.getTicketId(), ticket.getAttemptId(), ticket.getRiskScore());
        } catch (Exception e) {
            log.error("Failed to enqueue manual review: attemptId={}", ticket.getAttemptId(), e);
        }
    }

    @Override
    public List<SecurityEvent> recentEvents(int limit) {
        return eventRepository.findByOrderByOccurredAtDesc(PageRequest.of(0, limit)).stream()
                .map(this::toEvent)
                .collect(Collectors.toList());
    }

    @Override
    public List<ReviewTicket> pendingReviews(int limit) {
        return reviewRepository.findByStatusOrderByCreatedAtDesc(ReviewTicket.STATUS_PENDING, PageRequest.of(0, limit)).stream()
                .map(JpaSecurityEventSink::toTicket)
                .collect(Collectors.toList());
    }

    private SecurityEvent toEvent(SecurityEventEntity entity) {
        return SecurityEvent.builder()
                .eventId(entity.getEventId())
                .eventType(entity.getEventType())
                .severity(entity.getSeverity())
                .userId(entity.getUserId())
                .ip(entity.getIp())
                .userAgent(entity.getUserAgent())
                .details(readDetails(entity))
                .riskScoreContribution(entity.getRiskScoreContribution())
                .occurredAt(entity.getOccurredAt())
                .build();
    }

    private Map<String, Object> readDetails(SecurityEventEntity entity) {
        if (entity.getDetails() == null) {
            return Collections.emptyMap();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(entity.getDetails(), DETAILS_TYPE));
        } catch (Exception e) {
            log.warn("Unreadable details on security event eventId={}", entity.getEventId());
            return Map.of("raw", entity.getDetails());
        }
    }

    private static AttemptRecord toRecord(PaymentAttemptEntity entity) {
        return AttemptRecord.builder()
                .attemptId(entity.getAttemptId())
                .userId(entity.getUserId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .providerId(entity.getProviderId())
                .countryCode(entity.getCountryCode())
                .phoneNumber(entity.getPhoneNumber())
                .sourceIp(entity.getSourceIp())
                .createdAt(entity.getCreatedAt())
                .status(entity.getStatus())
                .riskScore(entity.getRiskScore())
                .recommendation(entity.getRecommendation())
                .build();
    }

    private static ReviewTicket toTicket(ManualReviewEntity entity) {
        return ReviewTicket.builder()
                .ticketId(entity.getTicketId())
                .attemptId(entity.getAttemptId())
                .userId(entity.getUserId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .providerId(entity.getProviderId())
                .riskScore(entity.getRiskScore())
                .riskFactors(Collections.unmodifiableSet(new LinkedHashSet<>(entity.getRiskFactors())))
                .status(entity.getStatus())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
