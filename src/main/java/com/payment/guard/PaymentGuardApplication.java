package com.payment.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the payment guard service. Provides:
 * <ul>
 *   <li>Payment attempt checks: rate limiting, provider validation, daily limits, risk scoring</li>
 *   <li>Webhook authentication (HMAC-SHA256 with replay protection)</li>
 *   <li>Security events in PostgreSQL, streamed to Kafka for audit</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PaymentGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentGuardApplication.class, args);
    }
}
