package com.payment.guard.risk.behavior;

import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BehaviorAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final BehaviorAnalyzer analyzer = new BehaviorAnalyzer();

    private static List<AttemptRecord> series(long[] secondsAgo, String[] amounts) {
        List<AttemptRecord> out = new ArrayList<>();
        for (int i = 0; i < secondsAgo.length; i++) {
            out.add(AttemptRecord.builder()
                    .attemptId("a" + i)
                    .userId("user-1")
                    .amount(new BigDecimal(amounts[i]))
                    .currency("NGN")
                    .status(AttemptStatus.PENDING)
                    .createdAt(NOW.minus(Duration.ofSeconds(secondsAgo[i])))
                    .build());
        }
        return out;
    }

    @Test
    void metronomicAttemptsFlagTiming() {
        List<AttemptRecord> attempts = series(new long[]{60, 120, 180, 240, 300},
                new String[]{"1234", "2345", "3456", "4567", "5678"});

        List<SecurityEvent> events = analyzer.analyze("user-1", attempts, NOW);

        assertThat(events).hasSize(1);
        SecurityEvent event = events.get(0);
        assertThat(event.getEventType()).isEqualTo(SecurityEventType.UNUSUAL_TIMING_PATTERN);
        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.getDetails()).containsEntry("pattern", "automated_regular_intervals");
    }

    @Test
    void irregularOrSlowTimingIsIgnored() {
        List<AttemptRecord> irregular = series(new long[]{10, 200, 230, 900, 1000},
                new String[]{"1234", "2345", "3456", "4567", "5678"});
        List<AttemptRecord> slow = series(new long[]{600, 1200, 1800, 2400, 3000},
                new String[]{"1234", "2345", "3456", "4567", "5678"});

        assertThat(analyzer.analyze("user-1", irregular, NOW)).isEmpty();
        assertThat(analyzer.analyze("user-1", slow, NOW)).isEmpty();
    }

    @Test
    void identicalAmountsFlagged() {
        List<AttemptRecord> attempts = series(new long[]{100, 900, 1000, 4000, 9000},
                new String[]{"2500", "2500.00", "2500", "2500", "2500"});

        List<SecurityEvent> events = analyzer.analyze("user-1", attempts, NOW);

        assertThat(events).singleElement()
                .satisfies(e -> assertThat(e.getDetails()).containsEntry("pattern", "identical_amounts"));
    }

    @Test
    void onlyRoundAmountsFlagged() {
        List<AttemptRecord> attempts = series(new long[]{100, 900, 1000, 4000, 9000},
                new String[]{"1000", "5000", "20000", "3000", "1000"});

        assertThat(analyzer.amountPattern(attempts)).isEqualTo("only_round_numbers");
    }

    @Test
    void fewerThanFiveAttemptsNeverFlag() {
        List<AttemptRecord> attempts = series(new long[]{60, 120, 180, 240},
                new String[]{"1000", "1000", "1000", "1000"});

        assertThat(analyzer.analyze("user-1", attempts, NOW)).isEmpty();
    }
}
