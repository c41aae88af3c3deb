package com.payment.guard.risk.behavior;

import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.AttemptRecord;
import com.payment.guard.domain.SecurityEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget hand-off for background behavior analysis. One worker drains a bounded queue;
 * a full queue drops the task. Results are written to the sink and only affect later assessments.
 */
@Slf4j
@Service
public class BehaviorAnalysisQueue {

    private final SecurityEventSink eventSink;
    private final BehaviorAnalyzer analyzer;
    private final Clock clock;
    private final boolean enabled;
    private final long lookbackSeconds;
    private final ThreadPoolExecutor executor;

    public BehaviorAnalysisQueue(SecurityEventSink eventSink, BehaviorAnalyzer analyzer, Clock clock,
                                 GuardProperties properties) {
        this.eventSink = eventSink;
        this.analyzer = analyzer;
        this.clock = clock;
        this.enabled = properties.getBehavior().isEnabled();
        this.lookbackSeconds = properties.getBehavior().getLookback().getSeconds();
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.getBehavior().getQueueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable, "behavior-analysis");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @return false when analysis is disabled or the queue is full
     */
    public boolean submit(String userId) {
        if (!enabled || userId == null) {
            return false;
        }
        try {
            executor.execute(() -> analyze(userId));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Behavior analysis queue full or stopped, dropping task for userId={}", userId);
            return false;
        }
    }

    void analyze(String userId) {
        try {
            List<AttemptRecord> attempts = eventSink.queryRecent(userId, lookbackSeconds);
            List<SecurityEvent> events = analyzer.analyze(userId, attempts, clock.instant());
            for (SecurityEvent event : events) {
                log.warn("Behavior pattern detected: userId={} type={} details={}", userId,
                        event.getEventType().getCode(), event.getDetails());
                eventSink.append(event);
            }
        } catch (Exception e) {
            log.error("Behavior analysis failed for userId={}", userId, e);
        }
    }

    int pending() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
