package com.payment.guard.validation;

import com.payment.guard.domain.PaymentAttempt;
import com.payment.guard.support.TestProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneAndAmountValidatorTest {

    private PhoneAndAmountValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PhoneAndAmountValidator(new ConfiguredProviderDirectory(
                TestProviders.withProviders(TestProviders.nigeriaMtn(), TestProviders.tanzaniaTigo())));
    }

    private static PaymentAttempt attempt(String provider, String country, String phone, String amount) {
        return PaymentAttempt.builder()
                .userId("user-1")
                .providerId(provider)
                .countryCode(country)
                .phoneNumber(phone)
                .amount(amount != null ? new BigDecimal(amount) : null)
                .currency("NGN")
                .build();
    }

    @Test
    void validAttemptGetsFeeQuoteAndFormattedPhone() {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", "08031234567", "10000"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getFee()).isEqualByComparingTo("50.00");
        assertThat(result.getTotal()).isEqualByComparingTo("10050.00");
        assertThat(result.getFormattedPhone()).isEqualTo("+234 803 123 4567");
    }

    @Test
    void missingFieldsAreReportedTogether() {
        PaymentAttempt attempt = PaymentAttempt.builder()
                .userId("user-1")
                .phoneNumber("12")
                .build();

        ValidationResult result = validator.validate(attempt);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors())
                .containsEntry(PhoneAndAmountValidator.FIELD_AMOUNT, "Amount is required")
                .containsEntry(PhoneAndAmountValidator.FIELD_CURRENCY, "Currency is required")
                .containsEntry(PhoneAndAmountValidator.FIELD_PROVIDER, "Provider and country are required");
        assertThat(result.getErrors().get(PhoneAndAmountValidator.FIELD_PROVIDER)).doesNotContain("null");
    }

    @ParameterizedTest
    @ValueSource(strings = {"08031234567", "+2348031234567", "2348031234567", "0803 123 4567"})
    void acceptsLocalAndInternationalForms(String phone) {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", phone, "500"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getFormattedPhone()).isEqualTo("+234 803 123 4567");
    }

    @Test
    void boundsAreInclusive() {
        assertThat(validator.validate(attempt("MTN_MOMO", "NG", "08031234567", "100")).isValid()).isTrue();
        assertThat(validator.validate(attempt("MTN_MOMO", "NG", "08031234567", "5000000")).isValid()).isTrue();
        assertThat(validator.validate(attempt("MTN_MOMO", "NG", "08031234567", "99")).getErrors())
                .containsEntry("amount", "Minimum amount is NGN 100");
        assertThat(validator.validate(attempt("MTN_MOMO", "NG", "08031234567", "5000001")).getErrors())
                .containsEntry("amount", "Maximum amount is NGN 5000000");
    }

    @Test
    void prefixOutsideAllowListRejected() {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", "08021234567", "500"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsEntry("phoneNumber", "This phone number is not compatible with MTN Mobile Money");
    }

    @Test
    void noPrefixListMeansNoRestriction() {
        ValidationResult result = validator.validate(attempt("TIGO_CASH", "TZ", "0712345678", "2000"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getFee()).isEqualByComparingTo("112.00");
        assertThat(result.getFormattedPhone()).isEqualTo("+255 712 345 678");
    }

    @Test
    void patternMismatchRejected() {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", "12345", "500"));

        assertThat(result.getErrors()).containsEntry("phoneNumber", "Invalid phone number format for MTN Mobile Money");
    }

    @Test
    void allFieldErrorsReportedTogether() {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", "", "-5"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors())
                .containsEntry("phoneNumber", "Phone number is required")
                .containsEntry("amount", "Amount must be greater than 0")
                .hasSize(2);
        assertThat(result.getFee()).isNull();
    }

    @Test
    void unknownProviderPairIsValidationError() {
        ValidationResult result = validator.validate(attempt("MPESA", "NG", "08031234567", "500"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsEntry("provider", "MPESA is not available in NG");
    }

    @Test
    void missingAmountRejected() {
        ValidationResult result = validator.validate(attempt("MTN_MOMO", "NG", "08031234567", null));

        assertThat(result.getErrors()).containsEntry("amount", "Amount is required");
    }
}
