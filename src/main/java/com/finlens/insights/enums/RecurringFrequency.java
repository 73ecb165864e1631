package com.finlens.insights.enums;

import java.math.BigDecimal;
import java.math.MathContext;

public enum RecurringFrequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("4.33");
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    /** Normalizes one occurrence amount to its monthly cost. */
    public BigDecimal toMonthly(BigDecimal amount) {
        return switch (this) {
            case DAILY -> amount.multiply(DAYS_PER_MONTH);
            case WEEKLY -> amount.multiply(WEEKS_PER_MONTH);
            case MONTHLY -> amount;
            case YEARLY -> amount.divide(MONTHS_PER_YEAR, MathContext.DECIMAL64);
        };
    }
}
