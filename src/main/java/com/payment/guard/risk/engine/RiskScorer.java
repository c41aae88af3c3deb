package com.payment.guard.risk.engine;

import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AttemptHistory;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.PaymentAttempt;
import com.payment.guard.domain.RiskAssessment;
import com.payment.guard.domain.RiskFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores a payment attempt 0-100 from the user's recent history and the request's device signals.
 * Each factor adds a fixed number of points; the sum is clamped and mapped to a recommendation.
 * <p>
 * Read-only: history comes in as a snapshot and nothing is written here. Counts are over prior
 * attempts only, so the attempt being scored never counts against itself. If scoring fails for any
 * reason the fallback assessment (50, REVIEW) is returned.
 */
@Slf4j
@Service
public class RiskScorer {

    private static final Pattern AUTOMATED_AGENT = Pattern.compile("bot|crawler|spider", Pattern.CASE_INSENSITIVE);
    private static final int MIN_USER_AGENT_LENGTH = 20;
    private static final int MAX_USER_AGENT_LENGTH = 500;

    private final GuardProperties.Risk risk;
    private final Set<String> suspiciousIps;
    private final Clock clock;

    public RiskScorer(GuardProperties properties, Clock clock) {
        this.risk = properties.getRisk();
        this.suspiciousIps = Set.copyOf(risk.getSuspiciousIps());
        this.clock = clock;
    }

    public RiskAssessment assess(PaymentAttempt attempt, AttemptHistory history) {
        Instant now = attempt.getTimestamp() != null ? attempt.getTimestamp() : clock.instant();
        if (history == null) {
            log.warn("No history for attemptId={} userId={}; using fallback assessment", attempt.getAttemptId(), attempt.getUserId());
            return RiskAssessment.fallback(now);
        }
        try {
            List<RiskFactor> fired = evaluate(attempt, history, now);
            RiskAssessment assessment = RiskAssessment.of(fired, now);
            log.debug("Risk assessment attemptId={} score={} factors={} recommendation={}",
                    attempt.getAttemptId(), assessment.getScore(), assessment.getFactors(), assessment.getRecommendation());
            return assessment;
        } catch (RuntimeException e) {
            log.error("Risk scoring failed for attemptId={} userId={}", attempt.getAttemptId(), attempt.getUserId(), e);
            return RiskAssessment.fallback(now);
        }
    }

    List<RiskFactor> evaluate(PaymentAttempt attempt, AttemptHistory history, Instant now) {
        List<AttemptRecord> prior = history.getAttempts().stream()
                .filter(a -> !Objects.equals(a.getAttemptId(), attempt.getAttemptId()))
                .filter(a -> a.getCreatedAt() != null && !a.getCreatedAt().isAfter(now))
                .collect(Collectors.toList());

        List<RiskFactor> fired = new ArrayList<>();

        // History-based
        if (countWithin(prior, now, risk.getRapidWindow()) >= risk.getRapidCount()) {
            fired.add(RiskFactor.RAPID_TRANSACTIONS);
        }
        if (attempt.getAmount() != null && attempt.getAmount().compareTo(risk.getLargeAmountThreshold()) >= 0) {
            fired.add(RiskFactor.LARGE_AMOUNT);
        }
        if (isNewAccount(history, now)) {
            fired.add(RiskFactor.NEW_USER);
        }
        if (countWithin(prior, now, risk.getVelocityWindow()) >= risk.getVelocityCount()) {
            fired.add(RiskFactor.HIGH_VELOCITY);
        }
        long failures = prior.stream()
                .filter(a -> isWithin(a, now, risk.getFailureWindow()))
                .filter(AttemptRecord::isFailed)
                .count();
        if (failures >= risk.getFailureCount()) {
            fired.add(RiskFactor.MULTIPLE_FAILURES);
        }
        if (isUnusualAmount(attempt, prior)) {
            fired.add(RiskFactor.UNUSUAL_AMOUNT);
        }

        // Device and network
        if (attempt.getSourceIp() != null && suspiciousIps.contains(attempt.getSourceIp())) {
            fired.add(RiskFactor.SUSPICIOUS_IP);
        }
        String userAgent = attempt.getUserAgent();
        if (userAgent != null && AUTOMATED_AGENT.matcher(userAgent).find()) {
            fired.add(RiskFactor.AUTOMATED_USER_AGENT);
        }
        if (isBlank(attempt.getAccept()) || isBlank(attempt.getAcceptEncoding())) {
            fired.add(RiskFactor.MISSING_HEADERS);
        }
        int userAgentLength = userAgent != null ? userAgent.length() : 0;
        if (userAgentLength < MIN_USER_AGENT_LENGTH || userAgentLength > MAX_USER_AGENT_LENGTH) {
            fired.add(RiskFactor.UNUSUAL_USER_AGENT);
        }

        if (hasDuplicate(attempt, prior, now)) {
            fired.add(RiskFactor.DUPLICATE_PAYMENT);
        }
        return fired;
    }

    private boolean isNewAccount(AttemptHistory history, Instant now) {
        return history.account()
                .filter(account -> account.getCreatedAt() != null)
                .map(account -> account.ageAt(now).compareTo(Duration.ofDays(risk.getNewAccountDays())) < 0)
                .orElse(false);
    }

    private boolean isUnusualAmount(PaymentAttempt attempt, List<AttemptRecord> prior) {
        if (attempt.getAmount() == null) {
            return false;
        }
        List<BigDecimal> amounts = prior.stream()
                .filter(a -> a.getAmount() != null)
                .filter(a -> attempt.getCurrency() == null || attempt.getCurrency().equalsIgnoreCase(a.getCurrency()))
                .map(AttemptRecord::getAmount)
                .collect(Collectors.toList());
        if (amounts.isEmpty()) {
            return false;
        }
        BigDecimal mean = amounts.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(amounts.size()), MathContext.DECIMAL64);
        if (mean.signum() == 0) {
            return false;
        }
        double deviation = attempt.getAmount().subtract(mean).abs()
                .divide(mean, MathContext.DECIMAL64)
                .doubleValue();
        return deviation >= risk.getUnusualAmountVariance();
    }

    /** Same user, amount, currency, provider and phone within the duplicate window; failed attempts don't count. */
    private boolean hasDuplicate(PaymentAttempt attempt, List<AttemptRecord> prior, Instant now) {
        String phone = normalizePhone(attempt.getPhoneNumber());
        return prior.stream()
                .filter(a -> isWithin(a, now, risk.getDuplicateWindow()))
                .filter(a -> !a.isFailed())
                .anyMatch(a -> Objects.equals(a.getUserId(), attempt.getUserId())
                        && a.getAmount() != null && attempt.getAmount() != null
                        && a.getAmount().compareTo(attempt.getAmount()) == 0
                        && equalsIgnoreCase(a.getCurrency(), attempt.getCurrency())
                        && equalsIgnoreCase(a.getProviderId(), attempt.getProviderId())
                        && Objects.equals(normalizePhone(a.getPhoneNumber()), phone));
    }

    private static long countWithin(List<AttemptRecord> prior, Instant now, Duration window) {
        return prior.stream().filter(a -> isWithin(a, now, window)).count();
    }

    private static boolean isWithin(AttemptRecord record, Instant now, Duration window) {
        return !record.getCreatedAt().isBefore(now.minus(window));
    }

    private static String normalizePhone(String phone) {
        return phone == null ? null : phone.replaceAll("\\s", "");
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
