package com.payment.guard.risk.behavior;

import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Longer-horizon pattern detection over a user's attempts: machine-regular timing and
 * scripted-looking amounts. Pure; the queue worker decides what to do with the events.
 */
@Component
public class BehaviorAnalyzer {

    static final int MIN_ATTEMPTS = 5;
    static final double MAX_TIMING_VARIATION = 0.1;
    static final Duration MAX_MEAN_INTERVAL = Duration.ofMinutes(5);
    private static final BigDecimal ROUND_UNIT = BigDecimal.valueOf(1000);

    public List<SecurityEvent> analyze(String userId, List<AttemptRecord> attempts, Instant now) {
        List<SecurityEvent> events = new ArrayList<>();
        if (attempts == null || attempts.size() < MIN_ATTEMPTS) {
            return events;
        }

        Map<String, Object> timing = timingPattern(attempts);
        if (timing != null) {
            events.add(SecurityEvent.of(SecurityEventType.UNUSUAL_TIMING_PATTERN, Severity.MEDIUM, userId,
                    null, null, timing, now));
        }
        String amountPattern = amountPattern(attempts);
        if (amountPattern != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("pattern", amountPattern);
            details.put("attempts", attempts.size());
            events.add(SecurityEvent.of(SecurityEventType.UNUSUAL_AMOUNT_PATTERN, Severity.MEDIUM, userId,
                    null, null, details, now));
        }
        return events;
    }

    /** Details for a suspiciously regular series, null when timing looks normal. */
    Map<String, Object> timingPattern(List<AttemptRecord> attempts) {
        List<Instant> times = attempts.stream()
                .map(AttemptRecord::getCreatedAt)
                .filter(Objects::nonNull)
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        if (times.size() < MIN_ATTEMPTS) {
            return null;
        }
        double[] intervals = new double[times.size() - 1];
        for (int i = 1; i < times.size(); i++) {
            intervals[i - 1] = Duration.between(times.get(i), times.get(i - 1)).toMillis();
        }
        double mean = 0;
        for (double interval : intervals) {
            mean += interval;
        }
        mean /= intervals.length;
        if (mean <= 0) {
            return null;
        }
        double variance = 0;
        for (double interval : intervals) {
            variance += Math.pow(interval - mean, 2);
        }
        variance /= intervals.length;
        double coefficientOfVariation = Math.sqrt(variance) / mean;

        if (coefficientOfVariation < MAX_TIMING_VARIATION && mean < MAX_MEAN_INTERVAL.toMillis()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("pattern", "automated_regular_intervals");
            details.put("meanIntervalMs", Math.round(mean));
            details.put("coefficientOfVariation", coefficientOfVariation);
            details.put("attempts", times.size());
            return details;
        }
        return null;
    }

    /** identical_amounts, only_round_numbers, or null. */
    String amountPattern(List<AttemptRecord> attempts) {
        List<BigDecimal> amounts = attempts.stream()
                .map(AttemptRecord::getAmount)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (amounts.size() < MIN_ATTEMPTS) {
            return null;
        }
        long distinct = amounts.stream().map(BigDecimal::stripTrailingZeros).distinct().count();
        if (distinct == 1) {
            return "identical_amounts";
        }
        boolean allRound = amounts.stream().allMatch(a -> a.remainder(ROUND_UNIT).signum() == 0);
        if (allRound) {
            return "only_round_numbers";
        }
        return null;
    }
}
