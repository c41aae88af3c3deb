package com.payment.guard.domain;

/**
 * Independently triggered contributors to a fraud score, with their fixed point values.
 */
public enum RiskFactor {
    /** Many attempts by the same user in the last 5 minutes. */
    RAPID_TRANSACTIONS("rapid_transactions", 25),
    /** Amount at or above the configured large-amount threshold. */
    LARGE_AMOUNT("large_amount", 20),
    /** Account younger than the configured number of days. */
    NEW_USER("new_user", 15),
    /** Many attempts by the same user in the last hour. */
    HIGH_VELOCITY("high_velocity", 30),
    /** Several FAILED attempts in the last hour. */
    MULTIPLE_FAILURES("multiple_failures", 20),
    /** Amount far from the user's trailing mean. */
    UNUSUAL_AMOUNT("unusual_amount", 15),
    SUSPICIOUS_IP("suspicious_ip", 25),
    /** User-Agent looks like a bot, crawler or spider. */
    AUTOMATED_USER_AGENT("automated_user_agent", 40),
    /** Accept or Accept-Encoding missing. */
    MISSING_HEADERS("missing_headers", 20),
    /** User-Agent shorter than 20 or longer than 500 characters. */
    UNUSUAL_USER_AGENT("unusual_user_agent", 15),
    /** Same user, amount, currency, provider and phone within 5 minutes. */
    DUPLICATE_PAYMENT("duplicate_payment", 50);

    private final String tag;
    private final int points;

    RiskFactor(String tag, int points) {
        this.tag = tag;
        this.points = points;
    }

    public String getTag() {
        return tag;
    }

    public int getPoints() {
        return points;
    }
}
