package com.payment.guard.config;

import com.payment.guard.ratelimit.EndpointClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All tunables of the payment guard, bound once at startup from {@code guard.*}.
 * Components receive this object through their constructors; nothing reads it statically.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    @Valid
    private final Webhook webhook = new Webhook();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Risk risk = new Risk();

    private final Sink sink = new Sink();

    private final Audit audit = new Audit();

    @Valid
    private final DailyLimits dailyLimits = new DailyLimits();

    private final Behavior behavior = new Behavior();

    /** Provider directory rule table, one entry per (provider, country). */
    @Valid
    private List<Provider> providers = new ArrayList<>();

    @Getter
    @Setter
    public static class Webhook {
        /** HMAC secret per upstream source tag (yellowcard, internal, ...). */
        private Map<String, String> secrets = new HashMap<>();

        /** Maximum |now - timestamp| accepted for a delivery. */
        @Min(1)
        private long replayToleranceSeconds = 300;
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Counter store backing the limiter: memory or redis. */
        private String store = "memory";

        /** Overrides of the built-in per-class limits. */
        private Map<EndpointClass, Rule> classes = new EnumMap<>(EndpointClass.class);
    }

    @Getter
    @Setter
    public static class Rule {
        @Min(1)
        private int limit;

        @Min(1)
        private long windowSeconds;
    }

    @Getter
    @Setter
    public static class Risk {
        @DecimalMin("0")
        private BigDecimal largeAmountThreshold = new BigDecimal("1000000");

        /** |amount - mean| / mean at or above which an amount counts as unusual. */
        private double unusualAmountVariance = 0.9;

        @Min(1)
        private int rapidCount = 5;

        private Duration rapidWindow = Duration.ofMinutes(5);

        @Min(1)
        private int velocityCount = 10;

        private Duration velocityWindow = Duration.ofMinutes(60);

        @Min(1)
        private int failureCount = 3;

        private Duration failureWindow = Duration.ofMinutes(60);

        private Duration duplicateWindow = Duration.ofMinutes(5);

        @Min(0)
        private int newAccountDays = 7;

        private Set<String> suspiciousIps = new HashSet<>();

        /** How far back history is read for scoring and daily limits. */
        @Min(3600)
        private long historyWindowSeconds = 86_400;
    }

    @Getter
    @Setter
    public static class Sink {
        /** jpa or memory. */
        private String type = "jpa";
    }

    @Getter
    @Setter
    public static class Audit {
        private final Kafka kafka = new Kafka();

        @Getter
        @Setter
        public static class Kafka {
            private boolean enabled = true;
            private String topic = "security-events";

            /** Events waiting for the publisher thread; further events are dropped with a warning. */
            @Min(1)
            private int queueCapacity = 10_000;
        }
    }

    @Getter
    @Setter
    public static class DailyLimits {
        private BigDecimal admin = new BigDecimal("10000000");
        private BigDecimal supplier = new BigDecimal("1000000");
        /** Accounts at least 30 days old. */
        private BigDecimal established = new BigDecimal("500000");
        /** Accounts at least 7 days old. */
        private BigDecimal verified = new BigDecimal("200000");
        /** Accounts younger than 7 days. */
        private BigDecimal fresh = new BigDecimal("50000");
        /** Users the account directory does not know. */
        private BigDecimal unknown = new BigDecimal("100000");
    }

    @Getter
    @Setter
    public static class Behavior {
        private boolean enabled = true;
        @Min(1)
        private int queueCapacity = 1000;
        private Duration lookback = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Provider {
        @NotBlank
        private String providerId;
        private String name;
        @NotBlank
        private String countryCode;
        @NotBlank
        private String dialingCode;
        @NotBlank
        private String phonePattern;
        private List<String> prefixes = new ArrayList<>();
        @DecimalMin("0")
        private BigDecimal minAmount;
        @DecimalMin("0")
        private BigDecimal maxAmount;
        private BigDecimal feePercentage = BigDecimal.ZERO;
        private BigDecimal feeFixed = BigDecimal.ZERO;
        private String currency;
    }
}
