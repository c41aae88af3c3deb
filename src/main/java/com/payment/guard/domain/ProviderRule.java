package com.payment.guard.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validation rules for one (provider, country) pair, owned by the provider directory.
 */
@Value
@Builder
public class ProviderRule {

    String providerId;
    String providerName;
    String countryCode;
    /** International dialing code without '+', e.g. 234 for Nigeria. */
    String dialingCode;
    Pattern phonePattern;
    /** National-number prefixes accepted by this provider; empty means no restriction. */
    List<String> prefixes;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    BigDecimal feePercentage;
    BigDecimal feeFixed;
    String currency;

    public boolean hasPrefixRestriction() {
        return prefixes != null && !prefixes.isEmpty();
    }
}
