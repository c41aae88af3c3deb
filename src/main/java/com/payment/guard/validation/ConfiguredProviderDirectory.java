package com.payment.guard.validation;

import com.payment.guard.config.GuardProperties;
import com.payment.guard.domain.ProviderRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Provider directory built once from {@code guard.providers}. Lookups are case-insensitive on both keys.
 */
@Slf4j
@Component
public class ConfiguredProviderDirectory implements ProviderDirectory {

    private final Map<String, ProviderRule> rules;

    public ConfiguredProviderDirectory(GuardProperties properties) {
        Map<String, ProviderRule> byKey = new HashMap<>();
        for (GuardProperties.Provider provider : properties.getProviders()) {
            ProviderRule rule = toRule(provider);
            String key = key(rule.getProviderId(), rule.getCountryCode());
            if (byKey.putIfAbsent(key, rule) != null) {
                throw new IllegalStateException("Duplicate provider rule for " + key);
            }
        }
        this.rules = Collections.unmodifiableMap(byKey);
        log.info("Provider directory loaded with {} rules", rules.size());
    }

    @Override
    public Optional<ProviderRule> lookup(String providerId, String countryCode) {
        if (providerId == null || countryCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(key(providerId, countryCode)));
    }

    private static ProviderRule toRule(GuardProperties.Provider p) {
        return ProviderRule.builder()
                .providerId(p.getProviderId().toUpperCase(Locale.ROOT))
                .providerName(p.getName() != null ? p.getName() : p.getProviderId())
                .countryCode(p.getCountryCode().toUpperCase(Locale.ROOT))
                .dialingCode(p.getDialingCode())
                .phonePattern(Pattern.compile(p.getPhonePattern()))
                .prefixes(p.getPrefixes() != null ? List.copyOf(p.getPrefixes()) : List.of())
                .minAmount(p.getMinAmount())
                .maxAmount(p.getMaxAmount())
                .feePercentage(p.getFeePercentage() != null ? p.getFeePercentage() : BigDecimal.ZERO)
                .feeFixed(p.getFeeFixed() != null ? p.getFeeFixed() : BigDecimal.ZERO)
                .currency(p.getCurrency())
                .build();
    }

    private static String key(String providerId, String countryCode) {
        return providerId.toUpperCase(Locale.ROOT) + ":" + countryCode.toUpperCase(Locale.ROOT);
    }
}
