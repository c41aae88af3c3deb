package com.payment.guard.risk.history;

import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AttemptHistory;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.UserAccount;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Reads a user's recent attempts and account under the "history" time limiter.
 * Empty result means history is unavailable (store error or timeout); callers fall back, never wait.
 */
@Slf4j
@Component
public class HistoryLoader {

    public static final String TIME_LIMITER = "history";

    private final SecurityEventSink eventSink;
    private final AccountDirectory accountDirectory;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final long windowSeconds;

    public HistoryLoader(SecurityEventSink eventSink,
                         AccountDirectory accountDirectory,
                         TimeLimiterRegistry timeLimiterRegistry,
                         @Qualifier("historyExecutor") ExecutorService executor,
                         GuardProperties properties) {
        this.eventSink = eventSink;
        this.accountDirectory = accountDirectory;
        this.timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER);
        this.executor = executor;
        this.windowSeconds = properties.getRisk().getHistoryWindowSeconds();
    }

    public Optional<AttemptHistory> load(String userId) {
        try {
            AttemptHistory history = timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> fetch(userId), executor));
            return Optional.of(history);
        } catch (TimeoutException e) {
            log.error("History lookup timed out for userId={} after {}", userId,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("History lookup interrupted for userId={}", userId, e);
            return Optional.empty();
        } catch (Exception e) {
            log.error("History lookup failed for userId={}", userId, e);
            return Optional.empty();
        }
    }

    private AttemptHistory fetch(String userId) {
        List<AttemptRecord> attempts = eventSink.queryRecent(userId, windowSeconds);
        UserAccount account = accountDirectory.find(userId).orElse(null);
        return AttemptHistory.builder()
                .attempts(attempts)
                .account(account)
                .build();
    }
}
