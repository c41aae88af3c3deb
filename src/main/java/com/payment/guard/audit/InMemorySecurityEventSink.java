package com.payment.guard.audit;

import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.ReviewTicket;
import com.payment.guard.domain.SecurityEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * Process-local sink for development and tests. Keeps the last events and all attempts in memory.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "guard.sink.type", havingValue = "memory")
public class InMemorySecurityEventSink implements SecurityEventSink {

    private static final int MAX_EVENTS = 10_000;

    private final Clock clock;
    private final ConcurrentLinkedDeque<SecurityEvent> events = new ConcurrentLinkedDeque<>();
    private final Map<String, AttemptRecord> attempts = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<ReviewTicket> reviews = new ConcurrentLinkedDeque<>();

    public InMemorySecurityEventSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void append(SecurityEvent event) {
        events.addFirst(event);
        while (events.size() > MAX_EVENTS) events.removeLast();
        log.debug("Appended security event type={} severity={} userId={}",
                event.getEventType().getCode(), event.getSeverity().code(), event.getUserId());
    }

    @Override
    public void recordAttempt(AttemptRecord attempt) {
        attempts.put(attempt.getAttemptId(), attempt);
    }

    @Override
    public boolean updateAttemptStatus(String attemptId, AttemptStatus status) {
        return attempts.computeIfPresent(attemptId, (id, existing) -> existing.toBuilder().status(status).build()) != null;
    }

    @Override
    public List<AttemptRecord> queryRecent(String userId, long withinSeconds) {
        Instant cutoff = clock.instant().minusSeconds(withinSeconds);
        return attempts.values().stream()
                .filter(a -> userId.equals(a.getUserId()))
                .filter(a -> !a.getCreatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(AttemptRecord::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public void enqueueForReview(ReviewTicket ticket) {
        reviews.addFirst(ticket);
    }

    @Override
    public List<SecurityEvent> recentEvents(int limit) {
        List<SecurityEvent> out = new ArrayList<>();
        for (SecurityEvent e : events) {
            if (out.size() >= limit) break;
            out.add(e);
        }
        return out;
    }

    @Override
    public List<ReviewTicket> pendingReviews(int limit) {
        return reviews.stream()
                .filter(t -> ReviewTicket.STATUS_PENDING.equals(t.getStatus()))
                .limit(limit)
                .collect(Collectors.toList());
    }
}
