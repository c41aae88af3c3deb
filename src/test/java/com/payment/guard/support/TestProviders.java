package com.payment.guard.support;

import com.payment.guard.config.GuardProperties;

import java.math.BigDecimal;
import java.util.List;

/**
 * Provider rows used across tests, mirroring the shipped catalog.
 */
public final class TestProviders {

    private TestProviders() {
    }

    public static GuardProperties.Provider nigeriaMtn() {
        GuardProperties.Provider p = new GuardProperties.Provider();
        p.setProviderId("MTN_MOMO");
        p.setName("MTN Mobile Money");
        p.setCountryCode("NG");
        p.setDialingCode("234");
        p.setPhonePattern("^(\\+234|234|0)?[789][01]\\d{8}$");
        p.setPrefixes(List.of("803", "806", "813", "814", "816", "903", "906", "913"));
        p.setMinAmount(new BigDecimal("100"));
        p.setMaxAmount(new BigDecimal("5000000"));
        p.setFeePercentage(new BigDecimal("0.5"));
        p.setFeeFixed(BigDecimal.ZERO);
        p.setCurrency("NGN");
        return p;
    }

    public static GuardProperties.Provider tanzaniaTigo() {
        GuardProperties.Provider p = new GuardProperties.Provider();
        p.setProviderId("TIGO_CASH");
        p.setName("Tigo Cash");
        p.setCountryCode("TZ");
        p.setDialingCode("255");
        p.setPhonePattern("^(\\+255|255|0)?[67]\\d{8}$");
        p.setMinAmount(new BigDecimal("1000"));
        p.setMaxAmount(new BigDecimal("3000000"));
        p.setFeePercentage(new BigDecimal("0.6"));
        p.setFeeFixed(new BigDecimal("100"));
        p.setCurrency("TZS");
        return p;
    }

    public static GuardProperties withProviders(GuardProperties.Provider... providers) {
        GuardProperties properties = new GuardProperties();
        properties.setProviders(List.of(providers));
        return properties;
    }
}
