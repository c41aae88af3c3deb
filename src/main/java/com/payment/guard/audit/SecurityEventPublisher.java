package com.payment.guard.audit;

import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.SecurityEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Streams security events to Kafka for SIEM ingestion and downstream fraud analytics.
 * Keyed by user id (IP for anonymous events) so one user's events stay ordered.
 * <p>
 * Fire-and-forget: {@link #publish} only enqueues. A single publisher thread hands events to the
 * producer, so a slow or unreachable broker (metadata fetch blocks up to {@code max.block.ms})
 * never stalls the request path. A full queue drops the event with a warning; the database copy
 * written by the sink is unaffected.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "guard.audit.kafka.enabled", havingValue = "true")
public class SecurityEventPublisher {

    private final KafkaTemplate<String, SecurityEvent> securityEventKafkaTemplate;
    private final String topic;
    private final ThreadPoolExecutor executor;

    public SecurityEventPublisher(KafkaTemplate<String, SecurityEvent> securityEventKafkaTemplate,
                                  GuardProperties properties) {
        this.securityEventKafkaTemplate = securityEventKafkaTemplate;
        this.topic = properties.getAudit().getKafka().getTopic();
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.getAudit().getKafka().getQueueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable, "security-event-publisher");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @return false when the event was dropped because the queue is full or the publisher is stopped
     */
    public boolean publish(SecurityEvent event) {
        try {
            executor.execute(() -> send(event));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Security event publish queue full or stopped, dropping eventId={} type={}",
                    event.getEventId(), event.getEventType().getCode());
            return false;
        }
    }

    private void send(SecurityEvent event) {
        String key = event.getUserId() != null ? event.getUserId() : event.getIp();
        try {
            CompletableFuture<SendResult<String, SecurityEvent>> future =
                    securityEventKafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish security event eventId={} type={}",
                            event.getEventId(), event.getEventType().getCode(), ex);
                } else {
                    log.debug("Published security event eventId={} partition={} offset={}",
                            event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            log.error("Kafka send rejected for security event eventId={}", event.getEventId(), e);
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
