package com.payment.guard.audit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityAuditLoggerTest {

    @Test
    void phoneIsMaskedToLastFourDigits() {
        assertThat(SecurityAuditLogger.maskPhone("+2348031234567")).isEqualTo("***4567");
        assertThat(SecurityAuditLogger.maskPhone("1234")).isEqualTo("****");
        assertThat(SecurityAuditLogger.maskPhone(null)).isEqualTo("****");
    }
}
