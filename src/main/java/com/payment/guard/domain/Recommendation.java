package com.payment.guard.domain;

/**
 * Outcome suggested by the risk scorer. A step function of the 0-100 score.
 */
public enum Recommendation {
    APPROVE,
    REVIEW,
    REJECT;

    public static final int REJECT_THRESHOLD = 90;
    public static final int REVIEW_THRESHOLD = 60;

    public static Recommendation forScore(int score) {
        if (score >= REJECT_THRESHOLD) {
            return REJECT;
        }
        if (score >= REVIEW_THRESHOLD) {
            return REVIEW;
        }
        return APPROVE;
    }
}
