package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Snapshot of what is known about a user before scoring: recent attempts (most recent first)
 * and, when the account directory knows the user, the account itself.
 */
@Value
@Builder
public class AttemptHistory {

    List<AttemptRecord> attempts;
    UserAccount account;

    public static AttemptHistory empty() {
        return AttemptHistory.builder().attempts(List.of()).build();
    }

    public Optional<UserAccount> account() {
        return Optional.ofNullable(account);
    }

    /** Attempts created at or after {@code since}. */
    public List<AttemptRecord> since(Instant since) {
        return attempts.stream()
                .filter(a -> a.getCreatedAt() != null && !a.getCreatedAt().isBefore(since))
                .collect(Collectors.toList());
    }
}
