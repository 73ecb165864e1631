package com.finlens.insights.dto.insights;

import java.math.BigDecimal;

public record PeriodSummary(BigDecimal totalIncome, BigDecimal totalExpenses) {

    public static final PeriodSummary EMPTY = new PeriodSummary(BigDecimal.ZERO, BigDecimal.ZERO);

    public BigDecimal netFlow() {
        return totalIncome.subtract(totalExpenses);
    }
}
