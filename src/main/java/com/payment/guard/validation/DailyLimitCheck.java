package com.payment.guard.validation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DailyLimitCheck {

    boolean allowed;
    BigDecimal limit;
    BigDecimal usedToday;
    BigDecimal remaining;
}
