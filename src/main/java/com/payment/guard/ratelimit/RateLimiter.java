package com.payment.guard.ratelimit;

import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.SecurityEvent;
import com.payment.guard.domain.SecurityEventType;
import com.payment.guard.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-window rate limiter keyed by (identifier, endpoint class). The window a request falls in is
 * {@code floor(now / windowSeconds)}; the previous window's counter is dropped rather than blended in,
 * so bursts straddling a boundary can reach twice the limit.
 * <p>
 * Fails closed: if the counter store is unreachable the request is denied.
 */
@Slf4j
@Service
public class RateLimiter {

    private final CounterStore counterStore;
    private final SecurityEventSink eventSink;
    private final Clock clock;
    private final Map<EndpointClass, RateLimitRule> rules = new EnumMap<>(EndpointClass.class);

    public RateLimiter(CounterStore counterStore, SecurityEventSink eventSink, Clock clock, GuardProperties properties) {
        this.counterStore = counterStore;
        this.eventSink = eventSink;
        this.clock = clock;
        for (EndpointClass endpointClass : EndpointClass.values()) {
            GuardProperties.Rule override = properties.getRateLimit().getClasses().get(endpointClass);
            rules.put(endpointClass, override != null
                    ? new RateLimitRule(override.getLimit(), override.getWindowSeconds())
                    : endpointClass.defaultRule());
        }
        log.info("Rate limits configured: {}", rules);
    }

    public RateLimitDecision check(String identifier, EndpointClass endpointClass) {
        return check(identifier, endpointClass, null, null);
    }

    /**
     * Counts this request and decides whether it may proceed. The caller's IP and User-Agent only
     * enrich the security event written on rejection.
     */
    public RateLimitDecision check(String identifier, EndpointClass endpointClass, String ip, String userAgent) {
        RateLimitRule rule = ruleFor(endpointClass);
        Instant now = clock.instant();
        long windowStart = rule.windowStartFor(now.getEpochSecond());
        Instant resetAt = Instant.ofEpochSecond(windowStart + rule.getWindowSeconds());

        long count;
        try {
            count = counterStore.incrementAndGet(identifier, endpointClass, windowStart, rule);
        } catch (Exception e) {
            log.error("Rate-limit counter store unavailable: identifier={} class={}; denying request",
                    identifier, endpointClass, e);
            Map<String, Object> details = details(identifier, endpointClass, rule, -1);
            details.put("error", e.getMessage());
            eventSink.append(SecurityEvent.of(SecurityEventType.RATE_LIMITER_UNAVAILABLE, Severity.HIGH,
                    null, ip, userAgent, details, now));
            return RateLimitDecision.builder()
                    .allowed(false)
                    .remaining(0)
                    .resetAt(resetAt)
                    .limit(rule.getLimit())
                    .count(-1)
                    .storeAvailable(false)
                    .build();
        }

        boolean allowed = count <= rule.getLimit();
        if (!allowed) {
            log.warn("Rate limit exceeded: identifier={} class={} count={} limit={} window={}s",
                    identifier, endpointClass, count, rule.getLimit(), rule.getWindowSeconds());
            eventSink.append(SecurityEvent.of(SecurityEventType.RATE_LIMIT_EXCEEDED, Severity.MEDIUM,
                    null, ip, userAgent, details(identifier, endpointClass, rule, count), now));
        }
        return RateLimitDecision.builder()
                .allowed(allowed)
                .remaining(allowed ? (int) (rule.getLimit() - count) : 0)
                .resetAt(resetAt)
                .limit(rule.getLimit())
                .count(count)
                .storeAvailable(true)
                .build();
    }

    public RateLimitRule ruleFor(EndpointClass endpointClass) {
        return rules.get(endpointClass);
    }

    private static Map<String, Object> details(String identifier, EndpointClass endpointClass, RateLimitRule rule, long count) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("identifier", identifier);
        details.put("endpointClass", endpointClass.name());
        details.put("limit", rule.getLimit());
        details.put("windowSeconds", rule.getWindowSeconds());
        if (count >= 0) {
            details.put("count", count);
        }
        return details;
    }
}
