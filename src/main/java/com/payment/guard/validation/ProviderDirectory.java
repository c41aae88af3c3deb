package com.payment.guard.validation;

import com.payment.guard.domain.ProviderRule;

import java.util.Optional;

/**
 * Read-only rule table keyed by (provider, country). Exactly one rule per pair.
 */
public interface ProviderDirectory {

    Optional<ProviderRule> lookup(String providerId, String countryCode);
}
