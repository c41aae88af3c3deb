package com.payment.guard.validation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of phone and amount validation. On success carries the fee quote and the normalised phone;
 * on failure every field error found, keyed by field name.
 */
@Value
@Builder
public class ValidationResult {

    boolean valid;
    Map<String, String> errors;
    BigDecimal fee;
    BigDecimal total;
    String formattedPhone;
}
