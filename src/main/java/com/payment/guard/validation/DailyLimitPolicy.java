package com.payment.guard.validation;

import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AccountRole;
import com.payment.guard.domain.AttemptHistory;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.PaymentAttempt;
import com.payment.guard.domain.UserAccount;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Per-user daily spend cap by account tier. Usage is the sum of COMPLETED attempts in the attempt's
 * currency since 00:00 UTC.
 */
@Component
public class DailyLimitPolicy {

    private final GuardProperties.DailyLimits limits;

    public DailyLimitPolicy(GuardProperties properties) {
        this.limits = properties.getDailyLimits();
    }

    public DailyLimitCheck check(PaymentAttempt attempt, AttemptHistory history, Instant now) {
        BigDecimal limit = limitFor(history.getAccount(), now);
        Instant startOfDay = now.atOffset(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();

        BigDecimal used = history.since(startOfDay).stream()
                .filter(AttemptRecord::isCompleted)
                .filter(a -> a.getAmount() != null)
                .filter(a -> attempt.getCurrency() == null || attempt.getCurrency().equalsIgnoreCase(a.getCurrency()))
                .map(AttemptRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal remaining = limit.subtract(used).max(BigDecimal.ZERO);
        boolean allowed = attempt.getAmount() == null || used.add(attempt.getAmount()).compareTo(limit) <= 0;
        return DailyLimitCheck.builder()
                .allowed(allowed)
                .limit(limit)
                .usedToday(used)
                .remaining(remaining)
                .build();
    }

    BigDecimal limitFor(UserAccount account, Instant now) {
        if (account == null) {
            return limits.getUnknown();
        }
        if (account.getRole() == AccountRole.ADMIN) {
            return limits.getAdmin();
        }
        if (account.getRole() == AccountRole.SUPPLIER) {
            return limits.getSupplier();
        }
        if (account.getCreatedAt() == null) {
            return limits.getUnknown();
        }
        Duration age = account.ageAt(now);
        if (age.toDays() >= 30) {
            return limits.getEstablished();
        }
        if (age.toDays() >= 7) {
            return limits.getVerified();
        }
        return limits.getFresh();
    }
}
