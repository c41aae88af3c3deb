package com.payment.guard.audit;

import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.ReviewTicket;
import com.payment.guard.domain.SecurityEvent;

import java.util.List;

/**
 * Durable store the pipeline writes its decisions to and reads history back from.
 * <p>
 * Write methods must not throw: a failed write is logged by the implementation and the decision
 * already taken stands. {@link #queryRecent} is the only read on the request path and may throw
 * {@link SecurityStoreException}; callers bound and handle it.
 */
public interface SecurityEventSink {

    void append(SecurityEvent event);

    void recordAttempt(AttemptRecord attempt);

    /**
     * @return false when no attempt with that id exists
     */
    boolean updateAttemptStatus(String attemptId, AttemptStatus status);

    /**
     * Prior attempts of {@code userId} created within the last {@code withinSeconds}, most recent first.
     */
    List<AttemptRecord> queryRecent(String userId, long withinSeconds);

    void enqueueForReview(ReviewTicket ticket);

    List<SecurityEvent> recentEvents(int limit);

    List<ReviewTicket> pendingReviews(int limit);
}
