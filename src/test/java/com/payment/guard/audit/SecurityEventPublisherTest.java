package com.payment.guard.audit;

import com.payment.guard.config.GuardProperties;
import com.payment.guard.config.KafkaConfig;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurityEventPublisherTest {

    @Mock
    private KafkaTemplate<String, SecurityEvent> kafkaTemplate;

    private SecurityEventPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.shutdown();
        }
    }

    private static SecurityEvent event(String userId, String ip) {
        return SecurityEvent.of(SecurityEventType.INVALID_SIGNATURE, Severity.HIGH, userId, ip, null,
                Map.of(), Instant.parse("2026-03-01T12:00:00Z"));
    }

    private static GuardProperties properties(int queueCapacity) {
        GuardProperties properties = new GuardProperties();
        properties.getAudit().getKafka().setQueueCapacity(queueCapacity);
        return properties;
    }

    @Test
    void keysByUserThenIp() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        publisher = new SecurityEventPublisher(kafkaTemplate, new GuardProperties());
        SecurityEvent withUser = event("user-1", "10.0.0.1");
        SecurityEvent anonymous = event(null, "52.1.1.1");

        publisher.publish(withUser);
        publisher.publish(anonymous);

        verify(kafkaTemplate, timeout(1000)).send(eq("security-events"), eq("user-1"), eq(withUser));
        verify(kafkaTemplate, timeout(1000)).send(eq("security-events"), eq("52.1.1.1"), eq(anonymous));
    }

    @Test
    void brokerFailureNeverPropagates() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        publisher = new SecurityEventPublisher(kafkaTemplate, new GuardProperties());

        assertThatCode(() -> publisher.publish(event("user-1", null))).doesNotThrowAnyException();
        verify(kafkaTemplate, timeout(1000)).send(eq("security-events"), eq("user-1"), any());
    }

    @Test
    void blockingSendDoesNotHoldTheCaller() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenAnswer(invocation -> {
            release.await();
            return new CompletableFuture<>();
        });
        publisher = new SecurityEventPublisher(kafkaTemplate, new GuardProperties());

        long started = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            assertThat(publisher.publish(event("user-" + i, null))).isTrue();
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofMillis(500));
        release.countDown();
        verify(kafkaTemplate, timeout(1000).times(5)).send(anyString(), anyString(), any());
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch sending = new CountDownLatch(1);
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenAnswer(invocation -> {
            sending.countDown();
            release.await();
            return new CompletableFuture<>();
        });
        publisher = new SecurityEventPublisher(kafkaTemplate, properties(1));

        assertThat(publisher.publish(event("user-1", null))).isTrue();
        sending.await();
        assertThat(publisher.publish(event("user-2", null))).isTrue();
        assertThat(publisher.publish(event("user-3", null))).isFalse();
        assertThat(publisher.pending()).isEqualTo(1);

        release.countDown();
    }

    @Test
    void unreachableBrokerDoesNotDelayPublish() {
        DefaultKafkaProducerFactory<String, SecurityEvent> factory = (DefaultKafkaProducerFactory<String, SecurityEvent>)
                new KafkaConfig().securityEventProducerFactory("127.0.0.1:1");
        factory.setPhysicalCloseTimeout(1);
        KafkaTemplate<String, SecurityEvent> template = new KafkaConfig().securityEventKafkaTemplate(factory);
        publisher = new SecurityEventPublisher(template, new GuardProperties());
        try {
            long started = System.nanoTime();
            for (int i = 0; i < 3; i++) {
                assertThat(publisher.publish(event("user-" + i, "52.1.1.1"))).isTrue();
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            assertThat(elapsed).isLessThan(Duration.ofMillis(500));
        } finally {
            publisher.shutdown();
            publisher = null;
            factory.destroy();
        }
    }
}
