package com.payment.guard.core;

import com.payment.guard.audit.SecurityAuditLogger;
import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.domain.AttemptHistory;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.PaymentAttempt;
import com.payment.guard.domain.ReviewTicket;
import com.payment.guard.domain.RiskAssessment;
import com.payment.guard.domain.RiskFactor;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import com.payment.guard.domain.WebhookEnvelope;
import com.payment.guard.ratelimit.EndpointClass;
import com.payment.guard.ratelimit.RateLimitDecision;
import com.payment.guard.ratelimit.RateLimiter;
import com.payment.guard.risk.behavior.BehaviorAnalysisQueue;
import com.payment.guard.risk.engine.RiskScorer;
import com.payment.guard.risk.history.HistoryLoader;
import com.payment.guard.validation.DailyLimitCheck;
import com.payment.guard.validation.DailyLimitPolicy;
import com.payment.guard.validation.PhoneAndAmountValidator;
import com.payment.guard.validation.ValidationResult;
import com.payment.guard.webhook.SignatureVerifier;
import com.payment.guard.webhook.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every payment attempt and webhook delivery.
 * <p>
 * Payments: rate limit, validate, daily limit, score, then approve, challenge (manual review) or reject.
 * Webhooks: rate limit, then verify signature; never scored.
 * Stages run in order within one call and a failing stage ends the run. Each terminal payment decision
 * writes one decision event; webhook refusals are recorded by the component that refused.
 * Sink and audit-log failures never change a decision already made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentGuard {

    static final String REASON_RATE_LIMITED = "rate_limited";
    static final String REASON_LIMITER_UNAVAILABLE = "rate_limiter_unavailable";
    static final String REASON_VALIDATION_FAILED = "validation_failed";
    static final String REASON_DAILY_LIMIT = "daily_limit_exceeded";
    static final String REASON_RISK_REJECTED = "risk_rejected";
    static final String REASON_MANUAL_REVIEW = "manual_review";
    static final String REASON_APPROVED = "approved";
    static final String UNKNOWN_IDENTIFIER = "unknown";

    private final RateLimiter rateLimiter;
    private final PhoneAndAmountValidator validator;
    private final DailyLimitPolicy dailyLimitPolicy;
    private final HistoryLoader historyLoader;
    private final RiskScorer riskScorer;
    private final SignatureVerifier signatureVerifier;
    private final SecurityEventSink eventSink;
    private final BehaviorAnalysisQueue behaviorQueue;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;

    public GuardDecision checkPayment(PaymentAttempt submitted) {
        Instant now = clock.instant();
        PaymentAttempt attempt = submitted.toBuilder()
                .attemptId(submitted.getAttemptId() != null ? submitted.getAttemptId() : UUID.randomUUID().toString())
                .timestamp(submitted.getTimestamp() != null ? submitted.getTimestamp() : now)
                .build();
        List<GuardState> trail = new ArrayList<>();
        trail.add(GuardState.RECEIVED);

        String identifier = attempt.getUserId() != null ? attempt.getUserId()
                : attempt.getSourceIp() != null ? attempt.getSourceIp() : UNKNOWN_IDENTIFIER;
        RateLimitDecision rateLimit = rateLimiter.check(identifier, EndpointClass.PAYMENT,
                attempt.getSourceIp(), attempt.getUserAgent());
        if (!rateLimit.isAllowed()) {
            trail.add(GuardState.REJECTED);
            GuardDecision decision = rateLimitedDecision(rateLimit, attempt.getAttemptId(), trail, now,
                    ReasonCode.PAYMENT_RATE_LIMIT);
            return finishPayment(attempt, decision, rateLimit.isStoreAvailable() ? Severity.MEDIUM : Severity.HIGH);
        }
        trail.add(GuardState.RATE_CHECKED);

        ValidationResult validation = validator.validate(attempt);
        if (!validation.isValid()) {
            trail.add(GuardState.REJECTED);
            GuardDecision decision = GuardDecision.builder()
                    .state(GuardState.REJECTED)
                    .reasonCode(ReasonCode.VALIDATION_ERROR)
                    .reason(REASON_VALIDATION_FAILED)
                    .attemptId(attempt.getAttemptId())
                    .validationErrors(validation.getErrors())
                    .trail(trail)
                    .build();
            return finishPayment(attempt, decision, Severity.LOW);
        }
        trail.add(GuardState.VALIDATED);

        Optional<AttemptHistory> history = historyLoader.load(attempt.getUserId());
        if (history.isPresent()) {
            DailyLimitCheck daily = dailyLimitPolicy.check(attempt, history.get(), now);
            if (!daily.isAllowed()) {
                log.warn("Daily limit exceeded: attemptId={} userId={} limit={} usedToday={} amount={}",
                        attempt.getAttemptId(), attempt.getUserId(), daily.getLimit(), daily.getUsedToday(), attempt.getAmount());
                trail.add(GuardState.REJECTED);
                GuardDecision decision = GuardDecision.builder()
                        .state(GuardState.REJECTED)
                        .reasonCode(ReasonCode.DAILY_LIMIT_EXCEEDED)
                        .reason(REASON_DAILY_LIMIT)
                        .attemptId(attempt.getAttemptId())
                        .validationErrors(Map.of("amount", "Daily limit of " + daily.getLimit().toPlainString()
                                + " exceeded; remaining today " + daily.getRemaining().toPlainString()))
                        .trail(trail)
                        .build();
                return finishPayment(attempt, decision, Severity.MEDIUM);
            }
        } else {
            log.warn("History unavailable for attemptId={} userId={}; daily limit skipped, using fallback assessment",
                    attempt.getAttemptId(), attempt.getUserId());
        }

        RiskAssessment assessment = history
                .map(h -> riskScorer.assess(attempt, h))
                .orElseGet(() -> RiskAssessment.fallback(now));
        trail.add(GuardState.SCORED);

        if (assessment.hasFactor(RiskFactor.DUPLICATE_PAYMENT)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("attemptId", attempt.getAttemptId());
            details.put("amount", attempt.getAmount());
            details.put("currency", attempt.getCurrency());
            details.put("providerId", attempt.getProviderId());
            safeAppend(SecurityEvent.of(SecurityEventType.DUPLICATE_PAYMENT, Severity.MEDIUM, attempt.getUserId(),
                    attempt.getSourceIp(), attempt.getUserAgent(), details, now));
        }
        if (assessment.isHighRisk()) {
            log.warn("High risk transaction: attemptId={} userId={} score={} factors={}",
                    attempt.getAttemptId(), attempt.getUserId(), assessment.getScore(), assessment.getFactors());
        }

        GuardDecision decision;
        AttemptStatus status;
        Severity severity;
        switch (assessment.getRecommendation()) {
            case REJECT:
                trail.add(GuardState.REJECTED);
                decision = scoredDecision(GuardState.REJECTED, ReasonCode.SECURITY_BLOCK, REASON_RISK_REJECTED,
                        attempt, assessment, validation, trail);
                status = AttemptStatus.BLOCKED;
                severity = Severity.HIGH;
                break;
            case REVIEW:
                trail.add(GuardState.CHALLENGED);
                decision = scoredDecision(GuardState.CHALLENGED, ReasonCode.MANUAL_REVIEW_REQUIRED, REASON_MANUAL_REVIEW,
                        attempt, assessment, validation, trail);
                status = AttemptStatus.UNDER_REVIEW;
                severity = Severity.MEDIUM;
                break;
            default:
                trail.add(GuardState.APPROVED);
                decision = scoredDecision(GuardState.APPROVED, null, REASON_APPROVED,
                        attempt, assessment, validation, trail);
                status = AttemptStatus.PENDING;
                severity = Severity.LOW;
                break;
        }

        safeRecordAttempt(AttemptRecord.of(attempt, assessment, status));
        if (decision.getState() == GuardState.CHALLENGED) {
            safeEnqueue(ReviewTicket.builder()
                    .ticketId(UUID.randomUUID().toString())
                    .attemptId(attempt.getAttemptId())
                    .userId(attempt.getUserId())
                    .amount(attempt.getAmount())
                    .currency(attempt.getCurrency())
                    .providerId(attempt.getProviderId())
                    .riskScore(assessment.getScore())
                    .riskFactors(assessment.getFactors())
                    .status(ReviewTicket.STATUS_PENDING)
                    .createdAt(now)
                    .build());
        }
        GuardDecision finished = finishPayment(attempt, decision, assessment.isHighRisk() ? Severity.HIGH : severity);
        behaviorQueue.submit(attempt.getUserId());
        return finished;
    }

    public GuardDecision checkWebhook(WebhookEnvelope envelope) {
        Instant now = clock.instant();
        List<GuardState> trail = new ArrayList<>();
        trail.add(GuardState.RECEIVED);

        String identifier = envelope.getSourceIp() != null ? envelope.getSourceIp() : UNKNOWN_IDENTIFIER;
        RateLimitDecision rateLimit = rateLimiter.check(identifier, EndpointClass.WEBHOOK,
                envelope.getSourceIp(), envelope.getUserAgent());
        if (!rateLimit.isAllowed()) {
            trail.add(GuardState.REJECTED);
            return finishWebhook(envelope, rateLimitedDecision(rateLimit, null, trail, now, ReasonCode.WEBHOOK_RATE_LIMIT));
        }
        trail.add(GuardState.RATE_CHECKED);

        VerificationResult verification = signatureVerifier.verify(envelope, envelope.getSourceTag());
        if (!verification.isValid()) {
            trail.add(GuardState.REJECTED);
            ReasonCode code = verification.getFailure().isInternal()
                    ? ReasonCode.VERIFICATION_ERROR
                    : ReasonCode.WEBHOOK_AUTH_FAILED;
            return finishWebhook(envelope, GuardDecision.builder()
                    .state(GuardState.REJECTED)
                    .reasonCode(code)
                    .reason(verification.getReason())
                    .trail(trail)
                    .build());
        }
        trail.add(GuardState.VALIDATED);
        trail.add(GuardState.APPROVED);
        return finishWebhook(envelope, GuardDecision.builder()
                .state(GuardState.APPROVED)
                .reason(REASON_APPROVED)
                .trail(trail)
                .build());
    }

    /**
     * Records the execution result of a previously checked attempt.
     *
     * @return false when the attempt is unknown
     */
    public boolean recordOutcome(String attemptId, AttemptStatus status) {
        if (status != AttemptStatus.COMPLETED && status != AttemptStatus.FAILED) {
            throw new IllegalArgumentException("Outcome must be COMPLETED or FAILED, got " + status);
        }
        boolean updated = eventSink.updateAttemptStatus(attemptId, status);
        if (updated) {
            log.info("Attempt outcome recorded: attemptId={} status={}", attemptId, status);
        } else {
            log.warn("Outcome for unknown attempt: attemptId={} status={}", attemptId, status);
        }
        return updated;
    }

    private GuardDecision rateLimitedDecision(RateLimitDecision rateLimit, String attemptId, List<GuardState> trail,
                                              Instant now, ReasonCode limitedCode) {
        if (!rateLimit.isStoreAvailable()) {
            return GuardDecision.builder()
                    .state(GuardState.REJECTED)
                    .reasonCode(ReasonCode.RATE_LIMITER_UNAVAILABLE)
                    .reason(REASON_LIMITER_UNAVAILABLE)
                    .attemptId(attemptId)
                    .trail(trail)
                    .build();
        }
        return GuardDecision.builder()
                .state(GuardState.REJECTED)
                .reasonCode(limitedCode)
                .reason(REASON_RATE_LIMITED)
                .attemptId(attemptId)
                .retryAfterSeconds(rateLimit.retryAfterSeconds(now))
                .rateLimitRemaining(rateLimit.getRemaining())
                .rateLimitResetAt(rateLimit.getResetAt())
                .trail(trail)
                .build();
    }

    private static GuardDecision scoredDecision(GuardState state, ReasonCode code, String reason, PaymentAttempt attempt,
                                                RiskAssessment assessment, ValidationResult validation,
                                                List<GuardState> trail) {
        GuardDecision.GuardDecisionBuilder builder = GuardDecision.builder()
                .state(state)
                .reasonCode(code)
                .reason(reason)
                .attemptId(attempt.getAttemptId())
                .riskScore(assessment.getScore())
                .riskFactors(assessment.getFactors())
                .trail(trail);
        if (state == GuardState.APPROVED) {
            builder.fee(validation.getFee())
                    .total(validation.getTotal())
                    .formattedPhone(validation.getFormattedPhone());
        } else if (state == GuardState.CHALLENGED) {
            builder.estimatedReviewTime(GuardDecision.ESTIMATED_REVIEW_TIME);
        }
        return builder.build();
    }

    private GuardDecision finishPayment(PaymentAttempt attempt, GuardDecision decision, Severity severity) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attemptId", attempt.getAttemptId());
        details.put("state", decision.getState().name());
        details.put("reasonCode", decision.getReasonCode() != null ? decision.getReasonCode().name() : null);
        details.put("reason", decision.getReason());
        details.put("trail", decision.getTrail().stream().map(Enum::name).toList());
        if (decision.getRiskScore() != null) {
            details.put("riskScore", decision.getRiskScore());
            details.put("riskFactors", List.copyOf(decision.getRiskFactors()));
        }
        if (decision.getValidationErrors() != null) {
            details.put("validationErrors", decision.getValidationErrors());
        }
        boolean highRisk = decision.getRiskScore() != null
                && decision.getRiskScore() >= RiskAssessment.HIGH_RISK_NOTIFICATION_THRESHOLD;
        SecurityEventType type = highRisk ? SecurityEventType.HIGH_RISK_TRANSACTION : SecurityEventType.PAYMENT_DECISION;
        safeAppend(SecurityEvent.of(type, severity, attempt.getUserId(), attempt.getSourceIp(),
                attempt.getUserAgent(), details, clock.instant()));
        try {
            auditLogger.logPaymentDecision(attempt, decision);
        } catch (RuntimeException e) {
            log.error("Audit log failed for attemptId={}", attempt.getAttemptId(), e);
        }
        return decision;
    }

    private GuardDecision finishWebhook(WebhookEnvelope envelope, GuardDecision decision) {
        try {
            auditLogger.logWebhookDecision(envelope.getSourceTag(), envelope.getSourceIp(), decision);
        } catch (RuntimeException e) {
            log.error("Audit log failed for webhook source={}", envelope.getSourceTag(), e);
        }
        return decision;
    }

    private void safeAppend(SecurityEvent event) {
        try {
            eventSink.append(event);
        } catch (RuntimeException e) {
            log.error("Failed to append security event type={} userId={}", event.getEventType().getCode(), event.getUserId(), e);
        }
    }

    private void safeRecordAttempt(AttemptRecord record) {
        try {
            eventSink.recordAttempt(record);
        } catch (RuntimeException e) {
            log.error("Failed to record attempt attemptId={}", record.getAttemptId(), e);
        }
    }

    private void safeEnqueue(ReviewTicket ticket) {
        try {
            eventSink.enqueueForReview(ticket);
        } catch (RuntimeException e) {
            log.error("Failed to enqueue manual review for attemptId={}", ticket.getAttemptId(), e);
        }
    }
}
