package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of scoring one payment attempt. Immutable; the factors keep the order they fired in.
 */
@Value
@Builder
public class RiskAssessment {

    /** Factor tag used when scoring itself failed. */
    public static final String ASSESSMENT_ERROR = "assessment_error";
    public static final int FALLBACK_SCORE = 50;
    /** Scores at or above this are reported as high risk even when only REVIEW is recommended. */
    public static final int HIGH_RISK_NOTIFICATION_THRESHOLD = 80;

    /** 0-100. */
    int score;
    Set<String> factors;
    Recommendation recommendation;
    Instant computedAt;

    public static RiskAssessment of(List<RiskFactor> fired, Instant computedAt) {
        int raw = fired.stream().mapToInt(RiskFactor::getPoints).sum();
        int score = Math.max(0, Math.min(100, raw));
        Set<String> tags = fired.stream()
                .map(RiskFactor::getTag)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return RiskAssessment.builder()
                .score(score)
                .factors(Collections.unmodifiableSet(tags))
                .recommendation(Recommendation.forScore(score))
                .computedAt(computedAt)
                .build();
    }

    /** Safe default when history is unavailable or scoring throws: never approve blind. */
    public static RiskAssessment fallback(Instant computedAt) {
        return RiskAssessment.builder()
                .score(FALLBACK_SCORE)
                .factors(Collections.singleton(ASSESSMENT_ERROR))
                .recommendation(Recommendation.REVIEW)
                .computedAt(computedAt)
                .build();
    }

    public boolean isHighRisk() {
        return score >= HIGH_RISK_NOTIFICATION_THRESHOLD;
    }

    public boolean hasFactor(RiskFactor factor) {
        return factors.contains(factor.getTag());
    }
}
