package com.payment.guard.risk.behavior;

import com.payment.guard.audit.InMemorySecurityEventSink;
import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BehaviorAnalysisQueueTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private BehaviorAnalysisQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    void analysisWritesPatternEventsToSink() {
        InMemorySecurityEventSink sink = new InMemorySecurityEventSink(clock);
        for (int i = 0; i < 5; i++) {
            sink.recordAttempt(AttemptRecord.builder()
                    .attemptId("a" + i)
                    .userId("user-1")
                    .amount(new BigDecimal("1000"))
                    .currency("NGN")
                    .status(AttemptStatus.PENDING)
                    .createdAt(NOW.minus(Duration.ofSeconds(60L * (i + 1))))
                    .build());
        }
        queue = new BehaviorAnalysisQueue(sink, new BehaviorAnalyzer(), clock, new GuardProperties());

        queue.analyze("user-1");

        assertThat(sink.recentEvents(10))
                .extracting(e -> e.getEventType())
                .containsExactlyInAnyOrder(SecurityEventType.UNUSUAL_TIMING_PATTERN, SecurityEventType.UNUSUAL_AMOUNT_PATTERN);
    }

    @Test
    void sinkFailureIsContained() {
        SecurityEventSink sink = mock(SecurityEventSink.class);
        when(sink.queryRecent(anyString(), anyLong())).thenThrow(new IllegalStateException("db down"));
        queue = new BehaviorAnalysisQueue(sink, new BehaviorAnalyzer(), clock, new GuardProperties());

        queue.analyze("user-1");
    }

    @Test
    void fullQueueDropsTasks() throws Exception {
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SecurityEventSink sink = mock(SecurityEventSink.class);
        when(sink.queryRecent(anyString(), anyLong())).thenAnswer(inv -> {
            blocked.countDown();
            release.await(5, TimeUnit.SECONDS);
            return java.util.List.of();
        });
        GuardProperties properties = new GuardProperties();
        properties.getBehavior().setQueueCapacity(1);
        queue = new BehaviorAnalysisQueue(sink, new BehaviorAnalyzer(), clock, properties);

        assertThat(queue.submit("user-1")).isTrue();
        assertThat(blocked.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.submit("user-2")).isTrue();
        assertThat(queue.submit("user-3")).isFalse();
        assertThat(queue.pending()).isEqualTo(1);

        release.countDown();
    }

    @Test
    void disabledQueueAcceptsNothing() {
        GuardProperties properties = new GuardProperties();
        properties.getBehavior().setEnabled(false);
        queue = new BehaviorAnalysisQueue(mock(SecurityEventSink.class), new BehaviorAnalyzer(), clock, properties);

        assertThat(queue.submit("user-1")).isFalse();
    }
}
