package com.finlens.insights.dto.insights;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Precomputed income/expense totals of one calendar month, in the requested currency.
 */
public record MonthlyAggregate(int year, int month, BigDecimal totalIncome, BigDecimal totalExpenses) {

    public LocalDate monthStart() {
        return LocalDate.of(year, month, 1);
    }

    public BigDecimal netFlow() {
        return totalIncome.subtract(totalExpenses);
    }
}
