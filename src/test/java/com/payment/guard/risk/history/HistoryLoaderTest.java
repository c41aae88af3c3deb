package com.payment.guard.risk.history;

import com.payment.guard.audit.InMemorySecurityEventSink;
import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.audit.SecurityStoreException;
import com.payment.guard.config.ExecutorConfig;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AccountRole;
import com.payment.guard.domain.AttemptHistory;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.UserAccount;
import com.payment.guard.support.MutableClock;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HistoryLoaderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private ExecutorService executor;
    private TimeLimiterRegistry registry;
    private InMemoryAccountDirectory accounts;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        registry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .cancelRunningFuture(true)
                .build());
        accounts = new InMemoryAccountDirectory();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private HistoryLoader loader(SecurityEventSink sink) {
        return new HistoryLoader(sink, accounts, registry, executor, new GuardProperties());
    }

    @Test
    void loadsAttemptsAndAccount() {
        InMemorySecurityEventSink sink = new InMemorySecurityEventSink(new MutableClock(NOW));
        sink.recordAttempt(AttemptRecord.builder()
                .attemptId("a1").userId("user-1").amount(new BigDecimal("100")).currency("NGN")
                .status(AttemptStatus.COMPLETED).createdAt(NOW.minus(Duration.ofHours(2))).build());
        sink.recordAttempt(AttemptRecord.builder()
                .attemptId("old").userId("user-1").amount(new BigDecimal("100")).currency("NGN")
                .status(AttemptStatus.COMPLETED).createdAt(NOW.minus(Duration.ofDays(2))).build());
        accounts.register(UserAccount.builder().userId("user-1").role(AccountRole.CUSTOMER)
                .createdAt(NOW.minus(Duration.ofDays(3))).build());

        Optional<AttemptHistory> history = loader(sink).load("user-1");

        assertThat(history).isPresent();
        assertThat(history.get().getAttempts()).extracting(AttemptRecord::getAttemptId).containsExactly("a1");
        assertThat(history.get().account()).isPresent();
    }

    @Test
    void slowStoreTimesOutToEmpty() {
        SecurityEventSink sink = mock(SecurityEventSink.class);
        when(sink.queryRecent(anyString(), anyLong())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return List.of();
        });

        long started = System.nanoTime();
        Optional<AttemptHistory> history = loader(sink).load("user-1");

        assertThat(history).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void storeErrorIsEmpty() {
        SecurityEventSink sink = mock(SecurityEventSink.class);
        when(sink.queryRecent(anyString(), anyLong())).thenThrow(new SecurityStoreException("db down"));

        assertThat(loader(sink).load("user-1")).isEmpty();
    }

    @Test
    void saturatedExecutorFallsBackToEmptyWithoutWaiting() throws Exception {
        executor.shutdownNow();
        executor = new ExecutorConfig().historyExecutor(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch running = new CountDownLatch(1);
        executor.execute(() -> {
            running.countDown();
            awaitQuietly(release);
        });
        running.await();
        executor.execute(() -> awaitQuietly(release));

        try {
            long started = System.nanoTime();
            Optional<AttemptHistory> history = loader(new InMemorySecurityEventSink(new MutableClock(NOW))).load("user-1");

            assertThat(history).isEmpty();
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(150));
        } finally {
            release.countDown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
