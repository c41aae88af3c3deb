package com.payment.guard.validation;

import com.payment.guard.domain.PaymentAttempt;
import com.payment.guard.domain.ProviderRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks a payment's phone number and amount against its provider rule and quotes the fee.
 * Every field is checked; errors are collected, not short-circuited.
 */
@Component
@RequiredArgsConstructor
public class PhoneAndAmountValidator {

    public static final String FIELD_PHONE = "phoneNumber";
    public static final String FIELD_AMOUNT = "amount";
    public static final String FIELD_PROVIDER = "provider";
    public static final String FIELD_CURRENCY = "currency";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ProviderDirectory providerDirectory;

    public ValidationResult validate(PaymentAttempt attempt) {
        ProviderRule rule = providerDirectory.lookup(attempt.getProviderId(), attempt.getCountryCode()).orElse(null);
        return validate(attempt, rule);
    }

    /**
     * @param rule the (provider, country) rule, null when the directory has none
     */
    public ValidationResult validate(PaymentAttempt attempt, ProviderRule rule) {
        Map<String, String> errors = new LinkedHashMap<>();
        String providerName = rule != null ? rule.getProviderName() : attempt.getProviderId();

        String formattedPhone = null;
        String phone = attempt.getPhoneNumber() == null ? "" : attempt.getPhoneNumber().replaceAll("\\s", "");
        if (phone.isEmpty()) {
            errors.put(FIELD_PHONE, "Phone number is required");
        } else if (rule != null) {
            if (!rule.getPhonePattern().matcher(phone).matches()) {
                errors.put(FIELD_PHONE, "Invalid phone number format for " + providerName);
            } else {
                String national = nationalNumber(phone, rule.getDialingCode());
                if (rule.hasPrefixRestriction() && rule.getPrefixes().stream().noneMatch(national::startsWith)) {
                    errors.put(FIELD_PHONE, "This phone number is not compatible with " + providerName);
                } else {
                    formattedPhone = format(national, rule.getDialingCode());
                }
            }
        }

        BigDecimal amount = attempt.getAmount();
        BigDecimal fee = null;
        BigDecimal total = null;
        if (amount == null) {
            errors.put(FIELD_AMOUNT, "Amount is required");
        } else if (amount.signum() <= 0) {
            errors.put(FIELD_AMOUNT, "Amount must be greater than 0");
        } else if (rule != null) {
            if (rule.getMinAmount() != null && amount.compareTo(rule.getMinAmount()) < 0) {
                errors.put(FIELD_AMOUNT, "Minimum amount is " + rule.getCurrency() + " " + rule.getMinAmount().toPlainString());
            } else if (rule.getMaxAmount() != null && amount.compareTo(rule.getMaxAmount()) > 0) {
                errors.put(FIELD_AMOUNT, "Maximum amount is " + rule.getCurrency() + " " + rule.getMaxAmount().toPlainString());
            } else {
                fee = fee(amount, rule);
                total = amount.add(fee);
            }
        }

        if (isBlank(attempt.getCurrency())) {
            errors.put(FIELD_CURRENCY, "Currency is required");
        }

        if (isBlank(attempt.getProviderId()) || isBlank(attempt.getCountryCode())) {
            errors.put(FIELD_PROVIDER, "Provider and country are required");
        } else if (rule == null) {
            errors.put(FIELD_PROVIDER, providerName + " is not available in " + attempt.getCountryCode());
        }

        if (!errors.isEmpty()) {
            return ValidationResult.builder()
                    .valid(false)
                    .errors(Collections.unmodifiableMap(errors))
                    .build();
        }
        return ValidationResult.builder()
                .valid(true)
                .errors(Collections.emptyMap())
                .fee(fee)
                .total(total)
                .formattedPhone(formattedPhone)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** fee = amount * pct / 100 + fixed, rounded half-up to 2 places. */
    static BigDecimal fee(BigDecimal amount, ProviderRule rule) {
        return amount.multiply(rule.getFeePercentage())
                .divide(HUNDRED)
                .add(rule.getFeeFixed())
                .setScale(2, RoundingMode.HALF_UP);
    }

    /** Strips '+', the dialing code or the trunk '0', leaving the national significant number. */
    static String nationalNumber(String phone, String dialingCode) {
        String digits = phone.startsWith("+") ? phone.substring(1) : phone;
        if (dialingCode != null && digits.startsWith(dialingCode)) {
            return digits.substring(dialingCode.length());
        }
        if (digits.startsWith("0")) {
            return digits.substring(1);
        }
        return digits;
    }

    /** {@code +<dial> NNN NNN N...}; shorter numbers keep what groups they have. */
    static String format(String national, String dialingCode) {
        StringBuilder out = new StringBuilder("+").append(dialingCode);
        int i = 0;
        while (i < national.length()) {
            int end = i < 6 ? Math.min(i + 3, national.length()) : national.length();
            out.append(' ').append(national, i, end);
            i = end;
        }
        return out.toString();
    }
}
